package com.washdispatch.dto;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * A payment the provider reports as succeeded. Tip and requested cleaner are optional; when absent the
 * values already stored on the job are used.
 */
@Getter
public class PaymentSucceededEvent {

    public static final String META_TIP_AMOUNT = "tipAmount";
    public static final String META_REQUESTED_CLEANER_ID = "requestedCleanerId";

    private final String paymentReference;
    private final BigDecimal tipAmount;
    private final Long requestedCleanerId;
    private final String source;

    public PaymentSucceededEvent(String paymentReference, BigDecimal tipAmount, Long requestedCleanerId, String source) {
        this.paymentReference = paymentReference;
        this.tipAmount = tipAmount;
        this.requestedCleanerId = requestedCleanerId;
        this.source = source;
    }

    /** Manual confirmation: everything comes from the job row. */
    public static PaymentSucceededEvent manual(String paymentReference) {
        return new PaymentSucceededEvent(paymentReference, null, null, "manual");
    }
}
