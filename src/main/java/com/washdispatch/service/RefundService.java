package com.washdispatch.service;

import com.washdispatch.exception.PaymentGatewayException;
import com.washdispatch.model.Job;
import com.washdispatch.model.ReconciliationIssueKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Complaint-driven refunds issued by an operator.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RefundService {

    private final JobLifecycleService jobLifecycleService;
    private final PaymentGateway paymentGateway;
    private final ReconciliationIssueService issueService;

    /**
     * Moves the job to REFUNDED, then returns the money. A provider failure leaves the job refunded
     * without a refund reference, opens a reconciliation issue and is rethrown for the caller.
     * So does a refund the provider accepted but the database could not store.
     */
    public Job refundJob(Long jobId, String reason) {
        Job job = jobLifecycleService.beginManualRefund(jobId, reason);

        // no receipt means the payment never went through, there is nothing to send back
        if (job.getReceiptNumber() == null) {
            log.info("Job {} refunded before payment was taken, no provider refund", jobId);
            return job;
        }

        String paymentReference = job.getPaymentReference();
        if (paymentReference == null || paymentReference.isBlank()) {
            log.error("Job {} has no payment reference, manual refund needs an operator", jobId);
            issueService.raise(jobId, ReconciliationIssueKind.MISSING_PAYMENT_REFERENCE,
                    "Manual refund requested for a job without payment reference");
            return job;
        }

        String refundReference;
        try {
            refundReference = paymentGateway.refund(paymentReference, reason);
        } catch (PaymentGatewayException e) {
            issueService.raise(jobId, ReconciliationIssueKind.REFUND_FAILED, e.getMessage());
            throw e;
        }
        try {
            jobLifecycleService.recordRefund(jobId, refundReference);
        } catch (RuntimeException e) {
            log.error("Refund {} for job {} went through but could not be recorded", refundReference, jobId, e);
            issueService.raise(jobId, ReconciliationIssueKind.REFUND_NOT_RECORDED,
                    RefundIssues.notRecorded(refundReference, e));
            throw e;
        }
        return jobLifecycleService.getJob(jobId);
    }
}
