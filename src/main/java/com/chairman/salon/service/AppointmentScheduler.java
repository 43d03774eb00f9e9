package com.chairman.salon.service;

import com.chairman.salon.dto.AppointmentView;
import com.chairman.salon.dto.BookingRequest;
import com.chairman.salon.dto.ValidationResult;
import com.chairman.salon.entity.Appointment;
import com.chairman.salon.entity.SalonService;
import com.chairman.salon.entity.ScheduleLock;
import com.chairman.salon.exception.AppointmentNotFoundException;
import com.chairman.salon.exception.InvalidAppointmentException;
import com.chairman.salon.exception.SchedulerException;
import com.chairman.salon.exception.TimeSlotUnavailableException;
import com.chairman.salon.repository.AppointmentRepository;
import com.chairman.salon.repository.ClientRepository;
import com.chairman.salon.repository.SalonServiceRepository;
import com.chairman.salon.repository.ScheduleLockRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Books, moves, lists and cancels appointments while keeping booked intervals
 * {@code [start, end)} free of overlaps. Back-to-back appointments are allowed.
 * <p>
 * Booking and rescheduling lock the {@code schedule_lock} row before checking
 * availability, so the check and the write commit as one unit even with several
 * writers on the same database.
 */
@Service
public class AppointmentScheduler {

    private static final Logger log = LoggerFactory.getLogger(AppointmentScheduler.class);

    private final AppointmentRepository appointmentRepository;
    private final SalonServiceRepository serviceRepository;
    private final ClientRepository clientRepository;
    private final ScheduleLockRepository lockRepository;
    private final InputValidator validator;

    public AppointmentScheduler(AppointmentRepository appointmentRepository,
                                SalonServiceRepository serviceRepository,
                                ClientRepository clientRepository,
                                ScheduleLockRepository lockRepository,
                                InputValidator validator) {
        this.appointmentRepository = appointmentRepository;
        this.serviceRepository = serviceRepository;
        this.clientRepository = clientRepository;
        this.lockRepository = lockRepository;
        this.validator = validator;
    }

    // =========================================================
    // AVAILABILITY
    // =========================================================

    /**
     * @throws InvalidAppointmentException {@code end} is not after {@code start}
     */
    @Transactional(readOnly = true)
    public boolean isTimeAvailable(LocalDateTime start, LocalDateTime end) {
        return isTimeAvailable(start, end, null);
    }

    /**
     * True when no appointment other than {@code excludeId} overlaps {@code [start, end)}.
     *
     * @throws InvalidAppointmentException {@code start} or {@code end} missing, or {@code end} not after {@code start}
     */
    @Transactional(readOnly = true)
    public boolean isTimeAvailable(LocalDateTime start, LocalDateTime end, Long excludeId) {
        checkInterval(start, end);
        try {
            boolean available = findOverlapping(start, end, excludeId).isEmpty();
            log.debug("Time slot {} to {} {} available", start, end, available ? "is" : "is not");
            return available;
        } catch (DataAccessException e) {
            log.error("Error checking availability of {} to {}", start, end, e);
            throw new SchedulerException("Failed to check time availability: " + e.getMessage(), e);
        }
    }

    // =========================================================
    // BOOK
    // =========================================================

    @Transactional
    public Long book(Long clientId, Long serviceId, LocalDateTime start) {
        return book(BookingRequest.of(clientId, serviceId, start));
    }

    /**
     * Books an appointment whose end is start + service duration + buffer, as
     * they are at this moment.
     *
     * @return id of the new appointment
     * @throws InvalidAppointmentException unknown service, missing start, notes or payment method too long
     * @throws TimeSlotUnavailableException the interval overlaps a booked appointment
     * @throws SchedulerException the store failed; nothing was written
     */
    @Transactional
    public Long book(BookingRequest request) {
        if (request.clientId() == null) {
            throw new InvalidAppointmentException("Client is required");
        }
        if (request.serviceId() == null) {
            throw new InvalidAppointmentException("Service is required");
        }
        if (request.start() == null) {
            throw new InvalidAppointmentException("Start time is required");
        }
        try {
            SalonService service = serviceRepository.findById(request.serviceId()).orElse(null);
            if (service == null) {
                log.warn("Attempted to book with non-existent service ID: {}", request.serviceId());
                throw new InvalidAppointmentException("Service with ID " + request.serviceId() + " does not exist");
            }

            LocalDateTime start = request.start();
            LocalDateTime end = start.plusMinutes(service.totalMinutes());

            ValidationResult notesCheck = validator.validateNotes(request.notes());
            if (!notesCheck.valid()) {
                throw new InvalidAppointmentException(notesCheck.errorMessage());
            }
            ValidationResult paymentCheck = validator.validatePaymentMethod(request.paymentMethod());
            if (!paymentCheck.valid()) {
                throw new InvalidAppointmentException(paymentCheck.errorMessage());
            }

            lockSchedule();

            List<Long> conflicts = findOverlapping(start, end, null);
            if (!conflicts.isEmpty()) {
                log.warn("Time slot {} to {} is not available, overlaps appointments {}", start, end, conflicts);
                throw unavailable(start, end, conflicts);
            }

            Appointment appointment = appointmentRepository.saveAndFlush(Appointment.builder()
                    .client(clientRepository.getReferenceById(request.clientId()))
                    .service(service)
                    .startTime(start)
                    .endTime(end)
                    .paid(request.paid())
                    .paymentMethod(StringUtils.defaultString(request.paymentMethod()).trim())
                    .notes(validator.sanitizeInput(request.notes()))
                    .build());

            log.info("Booked appointment {} for client {}, service {} from {} to {}",
                    appointment.getId(), request.clientId(), service.getId(), start, end);
            return appointment.getId();

        } catch (DataAccessException e) {
            log.error("Error booking appointment for client {} at {}", request.clientId(), request.start(), e);
            throw new SchedulerException("Failed to book appointment: " + e.getMessage(), e);
        }
    }

    // =========================================================
    // RESCHEDULE
    // =========================================================

    /**
     * Moves an appointment to a new start, keeping the length it was booked with.
     */
    @Transactional
    public AppointmentView reschedule(Long appointmentId, LocalDateTime newStart) {
        if (newStart == null) {
            throw new InvalidAppointmentException("Start time is required");
        }
        try {
            lockSchedule();

            Appointment appointment = appointmentRepository.findDetailedById(appointmentId).orElse(null);
            if (appointment == null) {
                log.warn("Attempted to reschedule non-existent appointment ID: {}", appointmentId);
                throw new AppointmentNotFoundException(appointmentId);
            }

            Duration length = Duration.between(appointment.getStartTime(), appointment.getEndTime());
            LocalDateTime newEnd = newStart.plus(length);

            List<Long> conflicts = findOverlapping(newStart, newEnd, appointmentId);
            if (!conflicts.isEmpty()) {
                log.warn("Cannot move appointment {} to {} - {}, overlaps appointments {}",
                        appointmentId, newStart, newEnd, conflicts);
                throw unavailable(newStart, newEnd, conflicts);
            }

            LocalDateTime oldStart = appointment.getStartTime();
            appointment.setStartTime(newStart);
            appointment.setEndTime(newEnd);
            appointment = appointmentRepository.saveAndFlush(appointment);

            log.info("Rescheduled appointment {} from {} to {}", appointmentId, oldStart, newStart);
            return AppointmentView.from(appointment);

        } catch (DataAccessException e) {
            log.error("Error rescheduling appointment {}", appointmentId, e);
            throw new SchedulerException("Failed to reschedule appointment: " + e.getMessage(), e);
        }
    }

    // =========================================================
    // READ
    // =========================================================

    /** Appointments starting on {@code day}, earliest first. */
    @Transactional(readOnly = true)
    public List<AppointmentView> listForDate(LocalDate day) {
        try {
            List<AppointmentView> views = appointmentRepository
                    .findDetailedByStartTimeBetween(day.atStartOfDay(), day.plusDays(1).atStartOfDay())
                    .stream()
                    .map(AppointmentView::from)
                    .toList();
            log.debug("Retrieved {} appointments for {}", views.size(), day);
            return views;
        } catch (DataAccessException e) {
            log.error("Error listing appointments for {}", day, e);
            throw new SchedulerException("Failed to retrieve appointments: " + e.getMessage(), e);
        }
    }

    @Transactional(readOnly = true)
    public Optional<AppointmentView> getAppointment(Long appointmentId) {
        try {
            return appointmentRepository.findDetailedById(appointmentId).map(AppointmentView::from);
        } catch (DataAccessException e) {
            log.error("Error retrieving appointment {}", appointmentId, e);
            throw new SchedulerException("Failed to retrieve appointment: " + e.getMessage(), e);
        }
    }

    // =========================================================
    // PAYMENT / CANCEL
    // =========================================================

    /**
     * Flips the paid flag.
     *
     * @return the new value
     */
    @Transactional
    public boolean togglePaid(Long appointmentId) {
        try {
            Appointment appointment = appointmentRepository.findById(appointmentId).orElse(null);
            if (appointment == null) {
                log.warn("Attempted to toggle non-existent appointment ID: {}", appointmentId);
                throw new AppointmentNotFoundException(appointmentId);
            }
            boolean paid = !appointment.isPaid();
            appointment.setPaid(paid);
            appointmentRepository.saveAndFlush(appointment);

            log.info("Toggled payment status for appointment {} to {}", appointmentId, paid ? "paid" : "unpaid");
            return paid;
        } catch (DataAccessException e) {
            log.error("Error toggling payment status for appointment {}", appointmentId, e);
            throw new SchedulerException("Failed to toggle payment status: " + e.getMessage(), e);
        }
    }

    /** Hard delete. */
    @Transactional
    public void delete(Long appointmentId) {
        try {
            if (!appointmentRepository.existsById(appointmentId)) {
                log.warn("Attempted to delete non-existent appointment ID: {}", appointmentId);
                throw new AppointmentNotFoundException(appointmentId);
            }
            appointmentRepository.deleteById(appointmentId);
            appointmentRepository.flush();
            log.info("Deleted appointment {}", appointmentId);
        } catch (DataAccessException e) {
            log.error("Error deleting appointment {}", appointmentId, e);
            throw new SchedulerException("Failed to delete appointment: " + e.getMessage(), e);
        }
    }

    // =========================================================
    // INTERNALS
    // =========================================================

    private List<Long> findOverlapping(LocalDateTime start, LocalDateTime end, Long excludeId) {
        return excludeId == null
                ? appointmentRepository.findOverlappingIds(start, end)
                : appointmentRepository.findOverlappingIdsExcluding(start, end, excludeId);
    }

    private TimeSlotUnavailableException unavailable(LocalDateTime start, LocalDateTime end, List<Long> conflicts) {
        List<Appointment> blocking = appointmentRepository.findAllById(conflicts);
        LocalDateTime occupiedStart = blocking.stream().map(Appointment::getStartTime)
                .min(Comparator.naturalOrder()).orElse(null);
        LocalDateTime occupiedEnd = blocking.stream().map(Appointment::getEndTime)
                .max(Comparator.naturalOrder()).orElse(null);
        return new TimeSlotUnavailableException(start, end, conflicts, occupiedStart, occupiedEnd);
    }

    /** Held until the surrounding transaction ends. */
    private void lockSchedule() {
        if (lockRepository.findByNameForUpdate(ScheduleLock.APPOINTMENTS).isPresent()) {
            return;
        }
        log.info("Creating missing schedule lock row");
        lockRepository.saveAndFlush(new ScheduleLock(ScheduleLock.APPOINTMENTS));
        lockRepository.findByNameForUpdate(ScheduleLock.APPOINTMENTS)
                .orElseThrow(() -> new SchedulerException("Schedule lock could not be acquired"));
    }

    private static void checkInterval(LocalDateTime start, LocalDateTime end) {
        if (start == null || end == null) {
            throw new InvalidAppointmentException("Start and end time are required");
        }
        if (!end.isAfter(start)) {
            throw new InvalidAppointmentException("End time must be after start time");
        }
    }
}
