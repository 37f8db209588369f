package com.ricemill.stockkeeper.event;

public enum ChangeType {
    STOCK_IN_RECORDED,
    STOCK_OUT_RECORDED,
    PRODUCT_CHANGED,
    SETTINGS_CHANGED
}
