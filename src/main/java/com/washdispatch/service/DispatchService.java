package com.washdispatch.service;

import com.washdispatch.config.AsyncConfig;
import com.washdispatch.dto.JobView;
import com.washdispatch.model.AssignmentMode;
import com.washdispatch.model.Cleaner;
import com.washdispatch.model.CleanerStatus;
import com.washdispatch.model.Job;
import com.washdispatch.model.JobStatus;
import com.washdispatch.repository.CleanerRepository;
import com.washdispatch.repository.JobRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Who may see and take a job. Eligibility is recomputed on every read; there is no stored queue.
 */
@Slf4j
@Service
public class DispatchService {

    private final CleanerRepository cleanerRepository;
    private final JobRepository jobRepository;
    private final GeofenceMatcher geofenceMatcher;
    private final ApplicationEventPublisher events;
    private final Executor dispatchExecutor;

    public DispatchService(CleanerRepository cleanerRepository,
                           JobRepository jobRepository,
                           GeofenceMatcher geofenceMatcher,
                           ApplicationEventPublisher events,
                           @Qualifier(AsyncConfig.DISPATCH_EXECUTOR) Executor dispatchExecutor) {
        this.cleanerRepository = cleanerRepository;
        this.jobRepository = jobRepository;
        this.geofenceMatcher = geofenceMatcher;
        this.events = events;
        this.dispatchExecutor = dispatchExecutor;
    }

    /**
     * On-duty, active cleaners of the company whose geofences cover the location, in repository order.
     * Each candidate is checked on the dispatch pool.
     */
    public List<Cleaner> eligibleCleaners(Long companyId, Double lat, Double lon) {
        List<Cleaner> candidates = cleanerRepository.findByCompanyIdAndStatusAndActiveTrue(companyId, CleanerStatus.ON_DUTY);
        if (candidates.isEmpty()) {
            return List.of();
        }

        List<CompletableFuture<Boolean>> checks = candidates.stream()
                .map(c -> CompletableFuture
                        .supplyAsync(() -> geofenceMatcher.isEligible(c, lat, lon), dispatchExecutor)
                        .exceptionally(ex -> {
                            log.warn("Eligibility check failed for cleaner {}: {}", c.getId(), ex.getMessage());
                            return false;
                        }))
                .toList();
        CompletableFuture.allOf(checks.toArray(new CompletableFuture[0])).join();

        List<Cleaner> eligible = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            if (Boolean.TRUE.equals(checks.get(i).join())) {
                eligible.add(candidates.get(i));
            }
        }
        return eligible;
    }

    public List<Cleaner> eligibleCleaners(Job job) {
        return eligibleCleaners(job.getCompanyId(), job.getLatitude(), job.getLongitude());
    }

    /** Same company, active, and covering the job location. Duty status is not part of it. */
    public boolean isEligibleFor(Cleaner cleaner, Job job) {
        return cleaner.isActive()
                && Objects.equals(cleaner.getCompanyId(), job.getCompanyId())
                && geofenceMatcher.isEligible(cleaner, job.getLatitude(), job.getLongitude());
    }

    /** PAID pool jobs the cleaner could accept right now. Empty unless the cleaner is on duty. */
    @Transactional(readOnly = true)
    public List<Job> availableJobsFor(Cleaner cleaner) {
        if (!cleaner.isActive() || cleaner.getStatus() != CleanerStatus.ON_DUTY) {
            return List.of();
        }
        return jobRepository.findByCompanyIdAndStatusAndCleanerIdIsNullOrderByCreatedAtAsc(cleaner.getCompanyId(), JobStatus.PAID)
                .stream()
                .filter(job -> geofenceMatcher.isEligible(cleaner, job.getLatitude(), job.getLongitude()))
                .toList();
    }

    /**
     * Runs inside the payment confirmation transaction, with the job row already locked.
     * Either the requested cleaner gets the job (ASSIGNED, DIRECT, cleaner BUSY) or the job goes
     * to the pool (PAID, POOL, request cleared).
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean resolveDirectAssignment(Job job, Long requestedCleanerId, Instant now) {
        Cleaner cleaner = null;
        String refusal = null;
        if (requestedCleanerId == null) {
            refusal = "no cleaner requested";
        } else {
            cleaner = cleanerRepository.findByIdForUpdate(requestedCleanerId).orElse(null);
            if (cleaner == null) {
                refusal = "cleaner does not exist";
            } else if (!cleaner.isActive()) {
                refusal = "cleaner is inactive";
            } else if (!Objects.equals(cleaner.getCompanyId(), job.getCompanyId())) {
                refusal = "cleaner belongs to company " + cleaner.getCompanyId();
            } else if (cleaner.getStatus() != CleanerStatus.ON_DUTY) {
                refusal = "cleaner is " + cleaner.getStatus().wireName();
            }
        }

        if (refusal == null) {
            job.transitionTo(JobStatus.ASSIGNED);
            job.setCleanerId(cleaner.getId());
            job.setAssignmentMode(AssignmentMode.DIRECT);
            job.setAssignedAt(now);
            job.setDirectAssignmentAt(now);
            cleaner.setStatus(CleanerStatus.BUSY);
            log.info("Job {} directly assigned to cleaner {}", job.getId(), cleaner.getId());
            return true;
        }

        if (requestedCleanerId != null) {
            log.info("Direct assignment of job {} to cleaner {} refused ({}), job goes to the pool",
                    job.getId(), requestedCleanerId, refusal);
        }
        job.transitionTo(JobStatus.PAID);
        job.setAssignmentMode(AssignmentMode.POOL);
        job.setRequestedCleanerId(null);
        return false;
    }

    @Async(AsyncConfig.NOTIFICATION_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onJobNotification(JobNotification notification) {
        if (notification.getEvent() == JobEventType.JOB_PAID) {
            announce(notification.getJob());
        }
    }

    /** Tells only the eligible cleaners about a new pool job. Returns who was told. */
    public List<Long> announce(JobView job) {
        List<Long> cleanerIds = eligibleCleaners(job.getCompanyId(), job.getLatitude(), job.getLongitude()).stream()
                .map(Cleaner::getId)
                .toList();
        if (cleanerIds.isEmpty()) {
            log.info("No eligible cleaner on duty for job {}", job.getId());
            return cleanerIds;
        }
        events.publishEvent(JobNotification.toCleaners(JobEventType.JOB_AVAILABLE, job, cleanerIds));
        log.debug("Job {} announced to cleaners {}", job.getId(), cleanerIds);
        return cleanerIds;
    }
}
