package com.washdispatch.model;

public enum UserRole {
    CLEANER,
    COMPANY_ADMIN,
    ADMIN
}
