package com.washdispatch.exception;

import lombok.Getter;

@Getter
public class PaymentNotCompletedException extends RuntimeException {

    private final String providerStatus;

    public PaymentNotCompletedException(String paymentReference, String providerStatus) {
        super("Payment " + paymentReference + " is not completed (status: " + providerStatus + ")");
        this.providerStatus = providerStatus;
    }
}
