package com.washdispatch.service;

import com.google.gson.JsonParseException;
import com.stripe.exception.EventDataObjectDeserializationException;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.model.Event;
import com.stripe.model.EventDataObjectDeserializer;
import com.stripe.model.PaymentIntent;
import com.stripe.model.StripeObject;
import com.stripe.net.Webhook;
import com.washdispatch.config.StripeProperties;
import com.washdispatch.dto.PaymentSucceededEvent;
import com.washdispatch.exception.WebhookSignatureException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

/**
 * Authenticates webhook deliveries and extracts the payment-succeeded payload.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookVerifier {

    public static final String PAYMENT_SUCCEEDED = "payment_intent.succeeded";

    private static final String SOURCE = "webhook";

    private final StripeProperties stripeProperties;

    /**
     * @return the provider event once the signature checks out
     * @throws WebhookSignatureException for a missing or invalid signature, or an unreadable body
     */
    public Event verify(String payload, String signatureHeader) {
        if (signatureHeader == null || signatureHeader.isBlank()) {
            throw new WebhookSignatureException("Missing Stripe-Signature header", null);
        }
        try {
            return Webhook.constructEvent(payload, signatureHeader,
                    stripeProperties.getWebhookSecret(), stripeProperties.getWebhookToleranceSeconds());
        } catch (SignatureVerificationException e) {
            throw new WebhookSignatureException("Invalid webhook signature", e);
        } catch (JsonParseException e) {
            throw new WebhookSignatureException("Unreadable webhook payload", e);
        }
    }

    /** Empty for every event type other than payment_intent.succeeded. */
    public Optional<PaymentSucceededEvent> toPaymentSucceeded(Event event) {
        if (!PAYMENT_SUCCEEDED.equals(event.getType())) {
            return Optional.empty();
        }
        Optional<PaymentIntent> intent = paymentIntentOf(event);
        if (intent.isEmpty() || intent.get().getId() == null || intent.get().getId().isBlank()) {
            log.warn("Event {} carries no readable payment intent", event.getId());
            return Optional.empty();
        }
        return Optional.of(fromMetadata(intent.get().getId(), intent.get().getMetadata()));
    }

    // events pinned to another API version only deserialize through the unsafe path
    private Optional<PaymentIntent> paymentIntentOf(Event event) {
        EventDataObjectDeserializer data = event.getDataObjectDeserializer();
        StripeObject object = data.getObject().orElse(null);
        if (object == null) {
            try {
                object = data.deserializeUnsafe();
            } catch (EventDataObjectDeserializationException e) {
                log.warn("Could not read data of event {} (api version {}): {}",
                        event.getId(), event.getApiVersion(), e.getMessage());
                return Optional.empty();
            }
        }
        return object instanceof PaymentIntent ? Optional.of((PaymentIntent) object) : Optional.empty();
    }

    PaymentSucceededEvent fromMetadata(String paymentReference, Map<String, String> metadata) {
        Map<String, String> meta = metadata == null ? Map.of() : metadata;
        return new PaymentSucceededEvent(paymentReference,
                parseAmount(paymentReference, meta.get(PaymentSucceededEvent.META_TIP_AMOUNT)),
                parseId(paymentReference, meta.get(PaymentSucceededEvent.META_REQUESTED_CLEANER_ID)),
                SOURCE);
    }

    private BigDecimal parseAmount(String ref, String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            BigDecimal v = new BigDecimal(raw.trim());
            return v.signum() < 0 ? null : v;
        } catch (NumberFormatException e) {
            log.warn("Ignoring unreadable tip '{}' on payment {}", raw, ref);
            return null;
        }
    }

    private Long parseId(String ref, String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return Long.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring unreadable cleaner id '{}' on payment {}", raw, ref);
            return null;
        }
    }
}
