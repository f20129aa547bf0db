package com.washdispatch.service;

import com.stripe.model.Event;
import com.washdispatch.config.StripeProperties;
import com.washdispatch.dto.PaymentSucceededEvent;
import com.washdispatch.exception.WebhookSignatureException;
import com.washdispatch.support.StripeWebhookPayloads;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebhookVerifierTest {

    private static final String SECRET = "whsec_unit";

    private WebhookVerifier verifier;

    @BeforeEach
    void setup() {
        StripeProperties properties = new StripeProperties();
        properties.setSecretKey("sk_test_unit");
        properties.setWebhookSecret(SECRET);
        verifier = new WebhookVerifier(properties);
    }

    @Test
    void validSignature_yieldsPaymentSucceeded() {
        String payload = StripeWebhookPayloads.paymentSucceeded("pi_123",
                Map.of(PaymentSucceededEvent.META_TIP_AMOUNT, "5.00", PaymentSucceededEvent.META_REQUESTED_CLEANER_ID, "17"));

        Event event = verifier.verify(payload, StripeWebhookPayloads.signatureHeader(payload, SECRET));
        Optional<PaymentSucceededEvent> succeeded = verifier.toPaymentSucceeded(event);

        assertThat(succeeded).isPresent();
        assertThat(succeeded.get().getPaymentReference()).isEqualTo("pi_123");
        assertThat(succeeded.get().getTipAmount()).isEqualByComparingTo("5.00");
        assertThat(succeeded.get().getRequestedCleanerId()).isEqualTo(17L);
        assertThat(succeeded.get().getSource()).isEqualTo("webhook");
    }

    @Test
    void signatureFromAnotherSecret_isRejected() {
        String payload = StripeWebhookPayloads.paymentSucceeded("pi_123", Map.of());

        assertThatThrownBy(() -> verifier.verify(payload, StripeWebhookPayloads.signatureHeader(payload, "whsec_other")))
                .isInstanceOf(WebhookSignatureException.class)
                .hasMessage("Invalid webhook signature");
    }

    @Test
    void tamperedBody_isRejected() {
        String payload = StripeWebhookPayloads.paymentSucceeded("pi_123", Map.of());
        String header = StripeWebhookPayloads.signatureHeader(payload, SECRET);

        assertThatThrownBy(() -> verifier.verify(payload.replace("pi_123", "pi_999"), header))
                .isInstanceOf(WebhookSignatureException.class);
    }

    @Test
    void missingHeader_isRejected() {
        assertThatThrownBy(() -> verifier.verify("{}", null))
                .isInstanceOf(WebhookSignatureException.class)
                .hasMessageContaining("Missing");
    }

    @Test
    void otherEventTypes_areIgnored() {
        String payload = StripeWebhookPayloads.event("payment_intent.payment_failed", "pi_123", "requires_payment_method", Map.of());

        Event event = verifier.verify(payload, StripeWebhookPayloads.signatureHeader(payload, SECRET));

        assertThat(verifier.toPaymentSucceeded(event)).isEmpty();
    }

    @Test
    void unreadableMetadata_fallsBackToStoredValues() {
        String payload = StripeWebhookPayloads.paymentSucceeded("pi_123",
                Map.of(PaymentSucceededEvent.META_TIP_AMOUNT, "lots", PaymentSucceededEvent.META_REQUESTED_CLEANER_ID, "abc"));

        PaymentSucceededEvent event = verifier.toPaymentSucceeded(
                verifier.verify(payload, StripeWebhookPayloads.signatureHeader(payload, SECRET))).orElseThrow();

        assertThat(event.getTipAmount()).isNull();
        assertThat(event.getRequestedCleanerId()).isNull();
    }

    @Test
    void eventFromAnotherApiVersion_isStillRead() {
        String payload = StripeWebhookPayloads.withApiVersion(
                StripeWebhookPayloads.paymentSucceeded("pi_old", Map.of(PaymentSucceededEvent.META_TIP_AMOUNT, "2.50")),
                "2020-08-27");

        Event event = verifier.verify(payload, StripeWebhookPayloads.signatureHeader(payload, SECRET));
        PaymentSucceededEvent succeeded = verifier.toPaymentSucceeded(event).orElseThrow();

        assertThat(succeeded.getPaymentReference()).isEqualTo("pi_old");
        assertThat(succeeded.getTipAmount()).isEqualByComparingTo("2.50");
    }

    @Test
    void signedGarbage_isRejectedAsUnreadable() {
        String payload = "not json at all";

        assertThatThrownBy(() -> verifier.verify(payload, StripeWebhookPayloads.signatureHeader(payload, SECRET)))
                .isInstanceOf(WebhookSignatureException.class);
    }

    @Test
    void negativeTip_isIgnored() {
        PaymentSucceededEvent event = verifier.fromMetadata("pi_neg", Map.of(PaymentSucceededEvent.META_TIP_AMOUNT, "-3"));

        assertThat(event.getTipAmount()).isNull();
        assertThat(event.getSource()).isEqualTo("webhook");
    }
}
