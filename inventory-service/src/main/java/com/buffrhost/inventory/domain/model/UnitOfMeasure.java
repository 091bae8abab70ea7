package com.buffrhost.inventory.domain.model;

public enum UnitOfMeasure {
    PIECE,
    KG,
    LITER,
    BOX,
    BOTTLE,
    PORTION
}
