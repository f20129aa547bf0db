package com.washdispatch.model;

public enum TransactionDirection {
    CREDIT,
    DEBIT
}
