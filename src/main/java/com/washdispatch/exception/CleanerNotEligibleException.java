package com.washdispatch.exception;

public class CleanerNotEligibleException extends RuntimeException {
    public CleanerNotEligibleException(Long cleanerId, Long jobId) {
        super("Cleaner " + cleanerId + " is not eligible for job " + jobId);
    }
}
