package com.washdispatch.service;

import com.washdispatch.dto.PaymentIntentSummary;
import com.washdispatch.exception.PaymentGatewayException;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Outbound calls to the payment provider. Never called while a job row is locked.
 * Every method throws {@link PaymentGatewayException} when the provider call fails.
 */
public interface PaymentGateway {

    PaymentIntentSummary createPaymentIntent(BigDecimal amount, String currency, Map<String, String> metadata);

    PaymentIntentSummary retrievePaymentIntent(String paymentReference);

    /**
     * Full refund of the payment. Returns the provider's refund id.
     */
    String refund(String paymentReference, String reason);
}
