package com.washdispatch.dto;

import lombok.Getter;

import java.util.Map;

/**
 * Provider-neutral view of a payment intent.
 */
@Getter
public class PaymentIntentSummary {
    private final String id;
    private final String clientSecret;
    private final String status;
    private final Map<String, String> metadata;

    public PaymentIntentSummary(String id, String clientSecret, String status, Map<String, String> metadata) {
        this.id = id;
        this.clientSecret = clientSecret;
        this.status = status;
        this.metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public boolean isSucceeded() {
        return "succeeded".equals(status);
    }
}
