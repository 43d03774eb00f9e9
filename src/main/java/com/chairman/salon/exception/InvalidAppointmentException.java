package com.chairman.salon.exception;

/** Appointment data failed validation, or referenced something that does not exist. */
public class InvalidAppointmentException extends SchedulerException {

    public InvalidAppointmentException(String message) {
        super(message);
    }
}
