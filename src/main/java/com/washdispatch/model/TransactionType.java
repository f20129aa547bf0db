package com.washdispatch.model;

public enum TransactionType {
    CUSTOMER_PAYMENT,
    REFUND
}
