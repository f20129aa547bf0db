package com.washdispatch.model;

public enum ReconciliationIssueKind {
    // provider refused or failed the refund call
    REFUND_FAILED,
    // job reached a refund path without a provider payment reference
    MISSING_PAYMENT_REFERENCE,
    // provider returned the money but the refund reference and DEBIT row were not stored
    REFUND_NOT_RECORDED
}
