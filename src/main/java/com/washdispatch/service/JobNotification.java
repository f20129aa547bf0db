package com.washdispatch.service;

import com.washdispatch.dto.JobView;
import com.washdispatch.model.Job;
import lombok.Getter;

import java.util.Collection;
import java.util.List;

/**
 * Published inside the transaction that changed the job; delivered by {@link NotificationFanout} after commit.
 */
@Getter
public class JobNotification {

    private final JobEventType event;
    private final JobView job;
    private final List<Long> recipientCleanerIds;

    public JobNotification(JobEventType event, JobView job, Collection<Long> recipientCleanerIds) {
        this.event = event;
        this.job = job;
        this.recipientCleanerIds = recipientCleanerIds == null ? List.of() : List.copyOf(recipientCleanerIds);
    }

    public static JobNotification of(JobEventType event, Job job) {
        return new JobNotification(event, JobView.from(job), List.of());
    }

    public static JobNotification toCleaners(JobEventType event, JobView job, Collection<Long> cleanerIds) {
        return new JobNotification(event, job, cleanerIds);
    }

    @Override
    public String toString() {
        return event + "(job " + (job == null ? null : job.getId()) + ")";
    }
}
