package com.washdispatch.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Payment provider credentials. Both secrets are mandatory: the application refuses to start without them.
 */
@ConfigurationProperties("stripe")
@Data
@Validated
public class StripeProperties {

    /**
     * Server-side API key used for payment intents and refunds.
     */
    @NotBlank
    private String secretKey;

    /**
     * Signing secret of the webhook endpoint, used to verify the Stripe-Signature header.
     */
    @NotBlank
    private String webhookSecret;

    /**
     * Maximum accepted age of a webhook signature timestamp.
     */
    @Positive
    private long webhookToleranceSeconds = 300;
}
