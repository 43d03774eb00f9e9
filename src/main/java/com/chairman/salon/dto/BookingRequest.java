package com.chairman.salon.dto;

import java.time.LocalDateTime;

public record BookingRequest(
        Long clientId,
        Long serviceId,
        LocalDateTime start,
        boolean paid,
        String paymentMethod,
        String notes
) {

    public static BookingRequest of(Long clientId, Long serviceId, LocalDateTime start) {
        return new BookingRequest(clientId, serviceId, start, false, "", "");
    }
}
