package com.washdispatch.exception;

public class JobNotFoundException extends RuntimeException {
    public JobNotFoundException(Long id) {
        super("Job not found with id: " + id);
    }

    public JobNotFoundException(String paymentReference) {
        super("Job not found for payment reference: " + paymentReference);
    }
}
