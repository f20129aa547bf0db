package com.washdispatch.service;

import com.washdispatch.exception.CleanerNotEligibleException;
import com.washdispatch.exception.CleanerNotFoundException;
import com.washdispatch.exception.JobNotFoundException;
import com.washdispatch.model.Cleaner;
import com.washdispatch.model.CleanerStatus;
import com.washdispatch.model.Job;
import com.washdispatch.model.JobStatus;
import com.washdispatch.repository.CleanerRepository;
import com.washdispatch.repository.CompanyRepository;
import com.washdispatch.repository.JobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Lock-based job transitions. Each public method is one transaction: the job row is locked first,
 * the cleaner row second, and notifications only leave after commit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobLifecycleService {

    public static final Set<JobStatus> ACTIVE_STATUSES = EnumSet.of(JobStatus.ASSIGNED, JobStatus.IN_PROGRESS);

    static final String UNATTENDED_REASON = "No cleaner accepted the job in time";

    private final JobRepository jobRepository;
    private final CleanerRepository cleanerRepository;
    private final CompanyRepository companyRepository;
    private final FinancialLedgerService ledger;
    private final ReferenceNumberGenerator referenceNumbers;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Job getJob(Long jobId) {
        return jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /** Jobs the cleaner currently holds (ASSIGNED or IN_PROGRESS). */
    @Transactional(readOnly = true)
    public List<Job> activeJobsOf(Long cleanerId) {
        return jobRepository.findByCleanerIdAndStatusIn(cleanerId, ACTIVE_STATUSES);
    }

    /**
     * Claims a PAID, unassigned job for the cleaner. Under contention exactly one caller wins;
     * every other caller gets false and nothing is written.
     */
    @Transactional
    public boolean acceptJob(Long jobId, Long cleanerId) {
        Optional<Job> locked = jobRepository.findByIdForUpdate(jobId);
        if (locked.isEmpty()) {
            return false;
        }
        Job job = locked.get();
        if (job.getStatus() != JobStatus.PAID || job.getCleanerId() != null) {
            log.debug("Job {} not available for cleaner {} (status {}, cleaner {})",
                    jobId, cleanerId, job.getStatus(), job.getCleanerId());
            return false;
        }

        Cleaner cleaner = cleanerRepository.findByIdForUpdate(cleanerId).orElse(null);
        if (cleaner == null || !cleaner.isActive()) {
            return false;
        }
        // one job per cleaner: BUSY already holds one, OFF_DUTY takes none
        if (cleaner.getStatus() != CleanerStatus.ON_DUTY) {
            log.debug("Cleaner {} is {}, cannot accept job {}", cleanerId, cleaner.getStatus(), jobId);
            return false;
        }

        Instant now = clock.instant();
        job.transitionTo(JobStatus.ASSIGNED);
        job.setCleanerId(cleanerId);
        job.setAssignedAt(now);
        job.setAcceptedAt(now);
        cleaner.setStatus(CleanerStatus.BUSY);
        ledger.assignCleaner(jobId, cleanerId);

        events.publishEvent(JobNotification.of(JobEventType.JOB_ASSIGNED, job));
        log.info("Job {} accepted by cleaner {}", jobId, cleanerId);
        return true;
    }

    @Transactional
    public Job startJob(Long jobId, Long cleanerId) {
        Job job = lockJob(jobId);
        requireAssignedTo(job, cleanerId);

        job.transitionTo(JobStatus.IN_PROGRESS);
        job.setStartedAt(clock.instant());

        events.publishEvent(JobNotification.of(JobEventType.JOB_STARTED, job));
        log.info("Job {} started by cleaner {}", jobId, cleanerId);
        return job;
    }

    @Transactional
    public Job completeJob(Long jobId, Long cleanerId, String proofPhotoUrl) {
        Job job = lockJob(jobId);
        requireAssignedTo(job, cleanerId);

        job.transitionTo(JobStatus.COMPLETED);
        job.setCompletedAt(clock.instant());
        job.setProofPhotoUrl(proofPhotoUrl);

        Cleaner cleaner = cleanerRepository.findByIdForUpdate(cleanerId)
                .orElseThrow(() -> new CleanerNotFoundException(cleanerId));
        cleaner.setTotalJobsCompleted(cleaner.getTotalJobsCompleted() + 1);
        releaseIfIdle(cleaner);
        companyRepository.incrementJobsCompleted(job.getCompanyId());

        events.publishEvent(JobNotification.of(JobEventType.JOB_COMPLETED, job));
        log.info("Job {} completed by cleaner {}", jobId, cleanerId);
        return job;
    }

    @Transactional
    public Job cancelJob(Long jobId, String reason) {
        Job job = lockJob(jobId);
        JobStatus from = job.getStatus();

        job.transitionTo(JobStatus.CANCELLED);
        releaseCleaner(job, from);

        events.publishEvent(JobNotification.of(JobEventType.JOB_CANCELLED, job));
        log.info("Job {} cancelled from {}: {}", jobId, from, reason);
        return job;
    }

    /**
     * First half of a manual refund: the job leaves the live states before any money moves.
     */
    @Transactional
    public Job beginManualRefund(Long jobId, String reason) {
        Job job = lockJob(jobId);
        JobStatus from = job.getStatus();

        job.transitionTo(JobStatus.REFUNDED);
        job.setRefundReason(reason);
        releaseCleaner(job, from);

        events.publishEvent(JobNotification.of(JobEventType.JOB_REFUNDED, job));
        log.info("Job {} moved from {} to refunded: {}", jobId, from, reason);
        return job;
    }

    /**
     * First half of an expiry refund. Re-checks status and age under the lock, so an acceptance that
     * won the race, or a second sweeper instance, makes this a no-op.
     */
    @Transactional
    public Optional<Job> lockOutUnattended(Long jobId, Instant cutoff) {
        Job job = jobRepository.findByIdForUpdate(jobId).orElse(null);
        if (job == null) {
            return Optional.empty();
        }
        if (job.getStatus() != JobStatus.PAID || job.getCleanerId() != null || !job.getCreatedAt().isBefore(cutoff)) {
            log.debug("Job {} no longer expirable (status {})", jobId, job.getStatus());
            return Optional.empty();
        }

        job.transitionTo(JobStatus.REFUNDED_UNATTENDED);
        job.setRefundReason(UNATTENDED_REASON);
        log.info("Job {} expired without a cleaner, locked out for refund", jobId);
        return Optional.of(job);
    }

    /**
     * Second half of any refund: stores the provider reference once and books the DEBIT row.
     * Returns false when the job already carries a refund reference.
     */
    @Transactional
    public boolean recordRefund(Long jobId, String refundReference) {
        Instant now = clock.instant();
        if (jobRepository.setRefundReferenceIfAbsent(jobId, refundReference, now) == 0) {
            log.warn("Job {} already has a refund reference, {} not recorded", jobId, refundReference);
            return false;
        }
        Job job = getJob(jobId);
        ledger.markRefunded(jobId, now);
        ledger.recordRefundDebit(job, refundReference);
        log.info("Refund {} recorded for job {}", refundReference, jobId);
        return true;
    }

    /** Mints the receipt number at most once per job. */
    @Transactional
    public boolean assignReceiptIfAbsent(Job job) {
        Instant now = clock.instant();
        String receiptNumber = referenceNumbers.receiptNumber(job.getId());
        if (jobRepository.setReceiptIfAbsent(job.getId(), receiptNumber, now) == 0) {
            return false;
        }
        // keep the managed entity in line with the row
        job.setReceiptNumber(receiptNumber);
        job.setReceiptGeneratedAt(now);
        return true;
    }

    private Job lockJob(Long jobId) {
        return jobRepository.findByIdForUpdate(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    private void requireAssignedTo(Job job, Long cleanerId) {
        if (!Objects.equals(job.getCleanerId(), cleanerId)) {
            throw new CleanerNotEligibleException(cleanerId, job.getId());
        }
    }

    private void releaseCleaner(Job job, JobStatus from) {
        if (job.getCleanerId() == null || !ACTIVE_STATUSES.contains(from)) {
            return;
        }
        cleanerRepository.findByIdForUpdate(job.getCleanerId()).ifPresent(this::releaseIfIdle);
    }

    // pending job changes are flushed before this query runs
    private void releaseIfIdle(Cleaner cleaner) {
        if (cleaner.getStatus() == CleanerStatus.BUSY
                && jobRepository.findByCleanerIdAndStatusIn(cleaner.getId(), ACTIVE_STATUSES).isEmpty()) {
            cleaner.setStatus(CleanerStatus.ON_DUTY);
        }
    }
}
