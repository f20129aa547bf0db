package com.washdispatch.service;

import com.stripe.exception.StripeException;
import com.stripe.model.PaymentIntent;
import com.stripe.model.Refund;
import com.stripe.net.RequestOptions;
import com.stripe.param.PaymentIntentCreateParams;
import com.stripe.param.RefundCreateParams;
import com.washdispatch.config.StripeProperties;
import com.washdispatch.dto.PaymentIntentSummary;
import com.washdispatch.exception.PaymentGatewayException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class StripePaymentGateway implements PaymentGateway {

    private final StripeProperties stripeProperties;

    @Override
    public PaymentIntentSummary createPaymentIntent(BigDecimal amount, String currency, Map<String, String> metadata) {
        try {
            PaymentIntentCreateParams params = PaymentIntentCreateParams.builder()
                    .setAmount(toMinorUnits(amount))
                    .setCurrency(currency.toLowerCase(Locale.ROOT))
                    .putAllMetadata(metadata)
                    .setAutomaticPaymentMethods(PaymentIntentCreateParams.AutomaticPaymentMethods.builder()
                            .setEnabled(true)
                            .build())
                    .build();

            PaymentIntent intent = PaymentIntent.create(params, requestOptions().build());
            log.info("Created payment intent {} for {} {}", intent.getId(), amount, currency);
            return toSummary(intent);

        } catch (StripeException e) {
            log.error("Stripe payment intent creation failed: {}", e.getMessage());
            throw new PaymentGatewayException(e.getMessage(), e);
        }
    }

    @Override
    public PaymentIntentSummary retrievePaymentIntent(String paymentReference) {
        try {
            return toSummary(PaymentIntent.retrieve(paymentReference, requestOptions().build()));
        } catch (StripeException e) {
            log.error("Stripe payment intent lookup failed for {}: {}", paymentReference, e.getMessage());
            throw new PaymentGatewayException(e.getMessage(), e);
        }
    }

    @Override
    public String refund(String paymentReference, String reason) {
        try {
            RefundCreateParams params = RefundCreateParams.builder()
                    .setPaymentIntent(paymentReference)
                    .setReason(RefundCreateParams.Reason.REQUESTED_BY_CUSTOMER)
                    .putMetadata("reason", reason == null ? "" : reason)
                    .build();

            // the provider collapses repeated refund requests for one payment
            Refund refund = Refund.create(params, requestOptions()
                    .setIdempotencyKey("refund-" + paymentReference)
                    .build());

            log.info("Refund {} issued for payment {} (status {})", refund.getId(), paymentReference, refund.getStatus());
            return refund.getId();

        } catch (StripeException e) {
            log.error("Stripe refund failed for {}: {}", paymentReference, e.getMessage());
            throw new PaymentGatewayException(e.getMessage(), e);
        }
    }

    private RequestOptions.RequestOptionsBuilder requestOptions() {
        return RequestOptions.builder().setApiKey(stripeProperties.getSecretKey());
    }

    private static long toMinorUnits(BigDecimal amount) {
        return amount.movePointRight(2).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    private static PaymentIntentSummary toSummary(PaymentIntent intent) {
        return new PaymentIntentSummary(intent.getId(), intent.getClientSecret(), intent.getStatus(), intent.getMetadata());
    }
}
