package com.washdispatch.service;

import com.washdispatch.dto.PaymentIntentSummary;
import com.washdispatch.dto.PaymentSucceededEvent;
import com.washdispatch.exception.PaymentNotCompletedException;
import com.washdispatch.model.Job;
import com.washdispatch.model.JobStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Client-driven payment confirmation, for when the webhook is late or lost.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentConfirmationService {

    private final JobLifecycleService jobLifecycleService;
    private final PaymentGateway paymentGateway;
    private final PaymentReconciliationService reconciliationService;

    public ReconciliationResult confirmPayment(Long jobId) {
        Job job = jobLifecycleService.getJob(jobId);
        if (job.getStatus() != JobStatus.PENDING_PAYMENT) {
            return ReconciliationResult.alreadyProcessed(job.getId(), job.getStatus());
        }
        if (job.getPaymentReference() == null) {
            throw new PaymentNotCompletedException("(none)", "missing_payment_reference");
        }

        PaymentIntentSummary intent = paymentGateway.retrievePaymentIntent(job.getPaymentReference());
        if (!intent.isSucceeded()) {
            log.info("Manual confirmation of job {} refused, payment {} is {}", jobId, intent.getId(), intent.getStatus());
            throw new PaymentNotCompletedException(job.getPaymentReference(), intent.getStatus());
        }

        return reconciliationService.reconcile(PaymentSucceededEvent.manual(job.getPaymentReference()));
    }
}
