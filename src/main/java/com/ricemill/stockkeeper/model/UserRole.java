package com.ricemill.stockkeeper.model;

public enum UserRole {
    SUPER_ADMIN,
    COMPANY_ADMIN,
    OPERATOR,
    VIEWER
}
