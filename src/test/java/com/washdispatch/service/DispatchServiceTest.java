package com.washdispatch.service;

import com.washdispatch.dto.JobView;
import com.washdispatch.model.AssignmentMode;
import com.washdispatch.model.Cleaner;
import com.washdispatch.model.CleanerStatus;
import com.washdispatch.model.Job;
import com.washdispatch.model.JobStatus;
import com.washdispatch.repository.CleanerRepository;
import com.washdispatch.repository.JobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DispatchServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T08:00:00Z");

    @Mock CleanerRepository cleanerRepository;
    @Mock JobRepository jobRepository;
    @Mock GeofenceMatcher geofenceMatcher;
    @Mock ApplicationEventPublisher events;

    private DispatchService dispatchService;

    @BeforeEach
    void setup() {
        // run eligibility checks on the calling thread
        dispatchService = new DispatchService(cleanerRepository, jobRepository, geofenceMatcher, events, Runnable::run);
    }

    private static Cleaner cleaner(long id, long companyId, CleanerStatus status) {
        Cleaner c = new Cleaner();
        c.setId(id);
        c.setCompanyId(companyId);
        c.setStatus(status);
        return c;
    }

    private static Job pendingJob() {
        Job job = new Job();
        job.setId(42L);
        job.setCompanyId(3L);
        job.setStatus(JobStatus.PENDING_PAYMENT);
        job.setRequestedCleanerId(7L);
        job.placeAt(25.08, 55.14);
        return job;
    }

    @Test
    void eligibleCleaners_keepsRepositoryOrderAndDropsFailures() {
        Cleaner a = cleaner(1L, 3L, CleanerStatus.ON_DUTY);
        Cleaner b = cleaner(2L, 3L, CleanerStatus.ON_DUTY);
        Cleaner c = cleaner(3L, 3L, CleanerStatus.ON_DUTY);
        when(cleanerRepository.findByCompanyIdAndStatusAndActiveTrue(3L, CleanerStatus.ON_DUTY)).thenReturn(List.of(a, b, c));
        when(geofenceMatcher.isEligible(eq(a), anyDouble(), anyDouble())).thenReturn(true);
        when(geofenceMatcher.isEligible(eq(b), anyDouble(), anyDouble())).thenThrow(new IllegalStateException("db down"));
        when(geofenceMatcher.isEligible(eq(c), anyDouble(), anyDouble())).thenReturn(true);

        assertThat(dispatchService.eligibleCleaners(3L, 25.08, 55.14)).containsExactly(a, c);
    }

    @Test
    void isEligibleFor_requiresSameCompany() {
        Job job = pendingJob();

        assertThat(dispatchService.isEligibleFor(cleaner(1L, 4L, CleanerStatus.ON_DUTY), job)).isFalse();
        verifyNoInteractions(geofenceMatcher);
    }

    @Test
    void availableJobs_emptyWhenOffDuty() {
        assertThat(dispatchService.availableJobsFor(cleaner(1L, 3L, CleanerStatus.OFF_DUTY))).isEmpty();
        verifyNoInteractions(jobRepository);
    }

    @Test
    void directAssignment_toOnDutyCleaner() {
        Job job = pendingJob();
        Cleaner requested = cleaner(7L, 3L, CleanerStatus.ON_DUTY);
        when(cleanerRepository.findByIdForUpdate(7L)).thenReturn(Optional.of(requested));

        assertThat(dispatchService.resolveDirectAssignment(job, 7L, NOW)).isTrue();

        assertThat(job.getStatus()).isEqualTo(JobStatus.ASSIGNED);
        assertThat(job.getCleanerId()).isEqualTo(7L);
        assertThat(job.getAssignmentMode()).isEqualTo(AssignmentMode.DIRECT);
        assertThat(job.getAssignedAt()).isEqualTo(NOW);
        assertThat(requested.getStatus()).isEqualTo(CleanerStatus.BUSY);
    }

    @Test
    void directAssignment_busyCleanerFallsBackToPool() {
        Job job = pendingJob();
        Cleaner requested = cleaner(7L, 3L, CleanerStatus.BUSY);
        when(cleanerRepository.findByIdForUpdate(7L)).thenReturn(Optional.of(requested));

        assertThat(dispatchService.resolveDirectAssignment(job, 7L, NOW)).isFalse();

        assertThat(job.getStatus()).isEqualTo(JobStatus.PAID);
        assertThat(job.getCleanerId()).isNull();
        assertThat(job.getAssignmentMode()).isEqualTo(AssignmentMode.POOL);
        assertThat(job.getRequestedCleanerId()).isNull();
        assertThat(requested.getStatus()).isEqualTo(CleanerStatus.BUSY);
    }

    @Test
    void directAssignment_unknownCleanerFallsBackToPool() {
        Job job = pendingJob();
        when(cleanerRepository.findByIdForUpdate(7L)).thenReturn(Optional.empty());

        assertThat(dispatchService.resolveDirectAssignment(job, 7L, NOW)).isFalse();
        assertThat(job.getStatus()).isEqualTo(JobStatus.PAID);
    }

    @Test
    void announce_publishesOnlyToEligibleCleaners() {
        Cleaner near = cleaner(1L, 3L, CleanerStatus.ON_DUTY);
        Cleaner far = cleaner(2L, 3L, CleanerStatus.ON_DUTY);
        when(cleanerRepository.findByCompanyIdAndStatusAndActiveTrue(3L, CleanerStatus.ON_DUTY)).thenReturn(List.of(near, far));
        when(geofenceMatcher.isEligible(eq(near), any(), any())).thenReturn(true);
        when(geofenceMatcher.isEligible(eq(far), any(), any())).thenReturn(false);

        JobView job = JobView.builder().id(42L).companyId(3L).latitude(25.08).longitude(55.14).status(JobStatus.PAID).build();

        assertThat(dispatchService.announce(job)).containsExactly(1L);
        ArgumentCaptor<JobNotification> published = ArgumentCaptor.forClass(JobNotification.class);
        verify(events).publishEvent(published.capture());
        assertThat(published.getValue().getEvent()).isEqualTo(JobEventType.JOB_AVAILABLE);
        assertThat(published.getValue().getRecipientCleanerIds()).containsExactly(1L);
    }

    @Test
    void announce_withoutEligibleCleanersPublishesNothing() {
        when(cleanerRepository.findByCompanyIdAndStatusAndActiveTrue(3L, CleanerStatus.ON_DUTY)).thenReturn(List.of());

        JobView job = JobView.builder().id(42L).companyId(3L).latitude(25.08).longitude(55.14).status(JobStatus.PAID).build();

        assertThat(dispatchService.announce(job)).isEmpty();
        verifyNoInteractions(events);
    }
}
