package com.washdispatch.exception;

public class CleanerNotFoundException extends RuntimeException {
    public CleanerNotFoundException(Long id) {
        super("Cleaner not found with id: " + id);
    }

    public CleanerNotFoundException(String email) {
        super("Cleaner profile not found for: " + email);
    }
}
