package com.washdispatch.exception;

/**
 * The payment provider rejected or failed a call. The message is the provider's own.
 */
public class PaymentGatewayException extends RuntimeException {
    public PaymentGatewayException(String message) {
        super(message);
    }

    public PaymentGatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
