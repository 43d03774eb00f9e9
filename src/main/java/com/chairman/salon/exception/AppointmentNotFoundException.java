package com.chairman.salon.exception;

import lombok.Getter;

@Getter
public class AppointmentNotFoundException extends InvalidAppointmentException {

    private final Long appointmentId;

    public AppointmentNotFoundException(Long appointmentId) {
        super("Appointment with ID " + appointmentId + " does not exist");
        this.appointmentId = appointmentId;
    }
}
