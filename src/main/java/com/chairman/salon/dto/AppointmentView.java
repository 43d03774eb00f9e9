package com.chairman.salon.dto;

import com.chairman.salon.entity.Appointment;
import com.chairman.salon.entity.Client;
import com.chairman.salon.entity.SalonService;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Read-side projection of an appointment joined with its client and service.
 * Client and service fields reflect their current values, the interval is the
 * one stored at booking time.
 */
public record AppointmentView(
        Long appointmentId,
        LocalDateTime startTime,
        LocalDateTime endTime,
        boolean paid,
        String paymentMethod,
        String notes,
        Long clientId,
        String clientName,
        String clientPhone,
        Long serviceId,
        String serviceName,
        BigDecimal servicePrice,
        int serviceDuration,
        int serviceBuffer
) {

    public static AppointmentView from(Appointment a) {
        Client c = a.getClient();
        SalonService s = a.getService();
        return new AppointmentView(
                a.getId(),
                a.getStartTime(),
                a.getEndTime(),
                a.isPaid(),
                a.getPaymentMethod() != null ? a.getPaymentMethod() : "",
                a.getNotes() != null ? a.getNotes() : "",
                c.getId(),
                c.getName(),
                c.getPhone() != null ? c.getPhone() : "",
                s.getId(),
                s.getName(),
                s.getPrice(),
                s.getDurationMinutes(),
                s.getBufferMinutes()
        );
    }
}
