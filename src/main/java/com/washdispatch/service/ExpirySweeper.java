package com.washdispatch.service;

import com.washdispatch.config.DispatchProperties;
import com.washdispatch.exception.PaymentGatewayException;
import com.washdispatch.model.Job;
import com.washdispatch.model.JobStatus;
import com.washdispatch.model.ReconciliationIssueKind;
import com.washdispatch.repository.JobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Refunds PAID jobs nobody accepted within the grace period.
 * The job is locked out first and the refund requested afterwards, outside the row lock,
 * so a cleaner can never accept a job whose money is on its way back.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExpirySweeper {

    private final JobRepository jobRepository;
    private final JobLifecycleService jobLifecycleService;
    private final PaymentGateway paymentGateway;
    private final ReconciliationIssueService issueService;
    private final DispatchProperties dispatchProperties;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    /**
     * One pass. A failure on one job never stops the others.
     *
     * @return number of jobs moved to REFUNDED_UNATTENDED
     */
    public int sweep() {
        Instant cutoff = clock.instant().minus(dispatchProperties.getExpiry().getGracePeriod());
        List<Long> candidates;
        try {
            candidates = jobRepository.findIdsByStatusCreatedBefore(JobStatus.PAID, cutoff);
        } catch (RuntimeException e) {
            log.error("Expiry sweep could not load candidates", e);
            return 0;
        }
        if (candidates.isEmpty()) {
            return 0;
        }

        int expired = 0;
        for (Long jobId : candidates) {
            try {
                if (expire(jobId, cutoff)) {
                    expired++;
                }
            } catch (RuntimeException e) {
                log.error("Expiry sweep failed for job {}", jobId, e);
            }
        }
        log.info("Expiry sweep: {} of {} candidate job(s) refunded as unattended", expired, candidates.size());
        return expired;
    }

    private boolean expire(Long jobId, Instant cutoff) {
        Optional<Job> lockedOut = jobLifecycleService.lockOutUnattended(jobId, cutoff);
        if (lockedOut.isEmpty()) {
            return false;
        }
        Job job = lockedOut.get();

        String paymentReference = job.getPaymentReference();
        if (paymentReference == null || paymentReference.isBlank()) {
            log.error("Job {} expired but has no payment reference, refund needs an operator", jobId);
            issueService.raise(jobId, ReconciliationIssueKind.MISSING_PAYMENT_REFERENCE,
                    "Expired unattended job has no payment reference");
        } else {
            refund(jobId, paymentReference, job.getRefundReason());
        }

        events.publishEvent(JobNotification.of(JobEventType.JOB_REFUNDED_UNATTENDED, jobLifecycleService.getJob(jobId)));
        return true;
    }

    private void refund(Long jobId, String paymentReference, String reason) {
        String refundReference;
        try {
            refundReference = paymentGateway.refund(paymentReference, reason);
        } catch (PaymentGatewayException e) {
            log.error("Refund of payment {} for expired job {} failed: {}", paymentReference, jobId, e.getMessage());
            issueService.raise(jobId, ReconciliationIssueKind.REFUND_FAILED, e.getMessage());
            return;
        }
        try {
            jobLifecycleService.recordRefund(jobId, refundReference);
        } catch (RuntimeException e) {
            log.error("Refund {} for expired job {} went through but could not be recorded", refundReference, jobId, e);
            issueService.raise(jobId, ReconciliationIssueKind.REFUND_NOT_RECORDED,
                    RefundIssues.notRecorded(refundReference, e));
        }
    }
}
