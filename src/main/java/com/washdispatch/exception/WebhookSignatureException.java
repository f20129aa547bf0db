package com.washdispatch.exception;

public class WebhookSignatureException extends RuntimeException {
    public WebhookSignatureException(String message, Throwable cause) {
        super(message, cause);
    }
}
