package com.washdispatch.service;

final class RefundIssues {

    private RefundIssues() {
    }

    // the refund id is what an operator needs to book the DEBIT by hand
    static String notRecorded(String refundReference, RuntimeException cause) {
        return "Refund " + refundReference + " issued but not recorded: " + cause.getMessage();
    }
}
