package com.chairman.salon.exception;

/**
 * Root of the appointment scheduling failures. Thrown directly for storage
 * failures, with the original cause attached.
 */
public class SchedulerException extends RuntimeException {

    public SchedulerException(String message) {
        super(message);
    }

    public SchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
