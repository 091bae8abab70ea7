package com.buffrhost.order.domain.model;

public enum OrderType {
    DINE_IN,
    TAKEAWAY,
    ROOM_SERVICE,
    DELIVERY
}
