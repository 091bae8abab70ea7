package com.buffrhost.availability.domain.model;

public enum ResourceKind {
    ROOM,
    TABLE
}
