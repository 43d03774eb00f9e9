package com.chairman.salon.service;

import com.chairman.salon.dto.BookingRequest;
import com.chairman.salon.dto.BookingResult;
import com.chairman.salon.exception.AppointmentNotFoundException;
import com.chairman.salon.exception.InvalidAppointmentException;
import com.chairman.salon.exception.SchedulerException;
import com.chairman.salon.exception.TimeSlotUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Booking entry point that reports every outcome as a {@link BookingResult}
 * instead of an exception. Each attempt runs in its own scheduler transaction.
 */
@Service
public class BookingService {

    private static final Logger log = LoggerFactory.getLogger(BookingService.class);

    private final AppointmentScheduler scheduler;

    public BookingService(AppointmentScheduler scheduler) {
        this.scheduler = scheduler;
    }

    public BookingResult tryBook(BookingRequest request) {
        try {
            return BookingResult.booked(scheduler.book(request));
        } catch (TimeSlotUnavailableException e) {
            return BookingResult.conflict(e.getMessage(), e.getStart(), e.getEnd(), e.getConflictingIds());
        } catch (AppointmentNotFoundException e) {
            return BookingResult.notFound(e.getMessage());
        } catch (InvalidAppointmentException e) {
            return BookingResult.invalidInput(e.getMessage());
        } catch (SchedulerException e) {
            log.error("Booking failed for client {} at {}", request.clientId(), request.start(), e);
            return BookingResult.storageFailure(e.getMessage());
        }
    }
}
