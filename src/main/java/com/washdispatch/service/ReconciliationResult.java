package com.washdispatch.service;

import com.washdispatch.model.JobStatus;
import lombok.Getter;

@Getter
public class ReconciliationResult {

    public enum Outcome {
        RECONCILED,
        ALREADY_PROCESSED,
        UNKNOWN_PAYMENT
    }

    private final Outcome outcome;
    private final Long jobId;
    private final JobStatus status;

    private ReconciliationResult(Outcome outcome, Long jobId, JobStatus status) {
        this.outcome = outcome;
        this.jobId = jobId;
        this.status = status;
    }

    public static ReconciliationResult reconciled(Long jobId, JobStatus status) {
        return new ReconciliationResult(Outcome.RECONCILED, jobId, status);
    }

    public static ReconciliationResult alreadyProcessed(Long jobId, JobStatus status) {
        return new ReconciliationResult(Outcome.ALREADY_PROCESSED, jobId, status);
    }

    public static ReconciliationResult unknownPayment() {
        return new ReconciliationResult(Outcome.UNKNOWN_PAYMENT, null, null);
    }
}
