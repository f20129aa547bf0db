package com.washdispatch.controller;

import com.stripe.model.Event;
import com.washdispatch.dto.PaymentSucceededEvent;
import com.washdispatch.service.PaymentReconciliationService;
import com.washdispatch.service.ReconciliationResult;
import com.washdispatch.service.WebhookVerifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Slf4j
@RestController
@RequestMapping("/api/payments")
public class PaymentWebhookController {

    private final WebhookVerifier webhookVerifier;
    private final PaymentReconciliationService reconciliationService;

    public PaymentWebhookController(WebhookVerifier webhookVerifier,
                                    PaymentReconciliationService reconciliationService) {
        this.webhookVerifier = webhookVerifier;
        this.reconciliationService = reconciliationService;
    }

    /**
     * Raw body is required: the signature is computed over the exact bytes the provider sent.
     * Unknown payments and other event types are acknowledged so the provider stops redelivering.
     */
    @PostMapping("/webhook")
    public ResponseEntity<Map<String, Object>> handleWebhook(
            @RequestBody String payload,
            @RequestHeader(value = "Stripe-Signature", required = false) String signature) {

        Event event = webhookVerifier.verify(payload, signature);

        Optional<PaymentSucceededEvent> succeeded = webhookVerifier.toPaymentSucceeded(event);
        if (succeeded.isEmpty()) {
            log.debug("Ignoring webhook event {} of type {}", event.getId(), event.getType());
            return ResponseEntity.ok(Map.of("received", true));
        }

        ReconciliationResult result = reconciliationService.reconcile(succeeded.get());
        return ResponseEntity.ok(Map.of(
                "received", true,
                "outcome", result.getOutcome().name().toLowerCase(Locale.ROOT)
        ));
    }
}
