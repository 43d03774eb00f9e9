package com.chairman.salon.dto;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Outcome of a booking attempt, for callers that prefer branching on a kind
 * over catching exceptions. Only the fields relevant to the kind are set.
 */
public record BookingResult(
        Kind kind,
        Long appointmentId,
        String message,
        LocalDateTime windowStart,
        LocalDateTime windowEnd,
        List<Long> conflictingIds
) {

    public enum Kind { BOOKED, CONFLICT, NOT_FOUND, INVALID_INPUT, STORAGE_FAILURE }

    public boolean success() {
        return kind == Kind.BOOKED;
    }

    public static BookingResult booked(Long appointmentId) {
        return new BookingResult(Kind.BOOKED, appointmentId, null, null, null, List.of());
    }

    public static BookingResult conflict(String msg, LocalDateTime start, LocalDateTime end, List<Long> conflictingIds) {
        return new BookingResult(Kind.CONFLICT, null, msg, start, end, conflictingIds);
    }

    public static BookingResult notFound(String msg) {
        return new BookingResult(Kind.NOT_FOUND, null, msg, null, null, List.of());
    }

    public static BookingResult invalidInput(String msg) {
        return new BookingResult(Kind.INVALID_INPUT, null, msg, null, null, List.of());
    }

    public static BookingResult storageFailure(String msg) {
        return new BookingResult(Kind.STORAGE_FAILURE, null, msg, null, null, List.of());
    }
}
