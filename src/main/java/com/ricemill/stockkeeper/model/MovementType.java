package com.ricemill.stockkeeper.model;

public enum MovementType {
    STOCK_IN,
    STOCK_OUT
}
