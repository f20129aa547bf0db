package com.washdispatch.it;

import com.washdispatch.dto.PaymentIntentSummary;
import com.washdispatch.model.Job;
import com.washdispatch.model.JobStatus;
import com.washdispatch.model.TransactionDirection;
import com.washdispatch.support.StripeWebhookPayloads;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ManualPaymentConfirmationIntegrationTest extends IntegrationTestSupport {

    @Test
    void manualConfirmationReachesTheSameStateAsTheWebhook() throws Exception {
        Job viaWebhook = job(JobStatus.PENDING_PAYMENT, "pi_hook", Duration.ofMinutes(1));
        Job viaManual = job(JobStatus.PENDING_PAYMENT, "pi_manual", Duration.ofMinutes(1));
        when(paymentGateway.retrievePaymentIntent("pi_manual"))
                .thenReturn(new PaymentIntentSummary("pi_manual", "secret", "succeeded", Map.of()));

        String payload = StripeWebhookPayloads.paymentSucceeded("pi_hook", Map.of());
        mvc.perform(post("/api/payments/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("Stripe-Signature", StripeWebhookPayloads.signatureHeader(payload, WEBHOOK_SECRET))
                        .content(payload))
                .andExpect(status().isOk());

        mvc.perform(post("/api/jobs/{id}/confirm-payment", viaManual.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("paid"))
                .andExpect(jsonPath("$.outcome").value("reconciled"));

        Job hooked = reload(viaWebhook);
        Job confirmed = reload(viaManual);
        assertThat(confirmed.getStatus()).isEqualTo(hooked.getStatus());
        assertThat(confirmed.getAssignmentMode()).isEqualTo(hooked.getAssignmentMode());
        assertThat(confirmed.getTotalAmount()).isEqualByComparingTo(hooked.getTotalAmount());
        assertThat(confirmed.getReceiptNumber()).isNotNull();
        assertThat(financialsRepository.countByJobId(confirmed.getId())).isEqualTo(1);
        assertThat(transactionRepository.findByJobIdAndDirection(confirmed.getId(), TransactionDirection.CREDIT)).hasSize(1);
    }

    @Test
    void webhookAfterManualConfirmationIsAlreadyProcessed() throws Exception {
        Job job = job(JobStatus.PENDING_PAYMENT, "pi_both", Duration.ofMinutes(1));
        when(paymentGateway.retrievePaymentIntent("pi_both"))
                .thenReturn(new PaymentIntentSummary("pi_both", "secret", "succeeded", Map.of()));

        mvc.perform(post("/api/jobs/{id}/confirm-payment", job.getId())).andExpect(status().isOk());
        String receipt = reload(job).getReceiptNumber();

        String payload = StripeWebhookPayloads.paymentSucceeded("pi_both", Map.of());
        mvc.perform(post("/api/payments/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("Stripe-Signature", StripeWebhookPayloads.signatureHeader(payload, WEBHOOK_SECRET))
                        .content(payload))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("already_processed"));

        assertThat(reload(job).getReceiptNumber()).isEqualTo(receipt);
        assertThat(financialsRepository.countByJobId(job.getId())).isEqualTo(1);
    }

    @Test
    void unfinishedPaymentIsReportedWith402() throws Exception {
        Job job = job(JobStatus.PENDING_PAYMENT, "pi_pending", Duration.ofMinutes(1));
        when(paymentGateway.retrievePaymentIntent("pi_pending"))
                .thenReturn(new PaymentIntentSummary("pi_pending", "secret", "requires_payment_method", Map.of()));

        mvc.perform(post("/api/jobs/{id}/confirm-payment", job.getId()))
                .andExpect(status().isPaymentRequired())
                .andExpect(jsonPath("$.paymentStatus").value("requires_payment_method"));

        assertThat(reload(job).getStatus()).isEqualTo(JobStatus.PENDING_PAYMENT);
    }

    @Test
    void alreadyPaidJobIsNotCheckedWithTheProviderAgain() throws Exception {
        Job job = job(JobStatus.PAID, "pi_done", Duration.ofMinutes(1));

        mvc.perform(post("/api/jobs/{id}/confirm-payment", job.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("already_processed"));

        verify(paymentGateway, never()).retrievePaymentIntent("pi_done");
    }
}
