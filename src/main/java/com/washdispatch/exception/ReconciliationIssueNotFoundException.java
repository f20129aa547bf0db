package com.washdispatch.exception;

public class ReconciliationIssueNotFoundException extends RuntimeException {
    public ReconciliationIssueNotFoundException(Long id) {
        super("Reconciliation issue not found with id: " + id);
    }
}
