package com.ricemill.stockkeeper.model;

public enum UserStatus {
    ACTIVE,
    INACTIVE
}
