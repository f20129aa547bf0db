package com.washdispatch.exception;

import com.washdispatch.model.JobStatus;
import lombok.Getter;

@Getter
public class InvalidJobTransitionException extends RuntimeException {

    private final Long jobId;
    private final JobStatus from;
    private final JobStatus to;

    public InvalidJobTransitionException(Long jobId, JobStatus from, JobStatus to) {
        super("Job " + jobId + " cannot move from " + from.wireName() + " to " + to.wireName());
        this.jobId = jobId;
        this.from = from;
        this.to = to;
    }

    public InvalidJobTransitionException(Long jobId, String message) {
        super(message);
        this.jobId = jobId;
        this.from = null;
        this.to = null;
    }
}
