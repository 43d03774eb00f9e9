package com.chairman.salon.service;

import com.chairman.salon.dto.AppointmentView;
import com.chairman.salon.dto.BookingRequest;
import com.chairman.salon.dto.ServiceRequest;
import com.chairman.salon.entity.Appointment;
import com.chairman.salon.entity.Client;
import com.chairman.salon.entity.SalonService;
import com.chairman.salon.exception.AppointmentNotFoundException;
import com.chairman.salon.exception.InvalidAppointmentException;
import com.chairman.salon.exception.SchedulerException;
import com.chairman.salon.exception.TimeSlotUnavailableException;
import com.chairman.salon.repository.AppointmentRepository;
import com.chairman.salon.repository.ClientRepository;
import com.chairman.salon.repository.SalonServiceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class AppointmentSchedulerTest {

    private static final LocalDate DAY = LocalDate.of(2024, 6, 1);

    @Autowired
    private AppointmentScheduler scheduler;

    @Autowired
    private ServiceCatalog catalog;

    @Autowired
    private AppointmentRepository appointmentRepository;

    @Autowired
    private SalonServiceRepository serviceRepository;

    @Autowired
    private ClientRepository clientRepository;

    private Long clientId;
    private Long haircutId;
    private Long fadeId;

    @BeforeEach
    void setUp() {
        appointmentRepository.deleteAllInBatch();
        serviceRepository.deleteAllInBatch();
        clientRepository.deleteAllInBatch();

        clientId = clientRepository.save(Client.builder().name("Marcus Reed").phone("(555) 123-4567").build()).getId();
        haircutId = serviceRepository.save(SalonService.builder()
                .name("Haircut").price(new BigDecimal("35.00")).durationMinutes(30).bufferMinutes(0).build()).getId();
        fadeId = serviceRepository.save(SalonService.builder()
                .name("Skin Fade").price(new BigDecimal("45.00")).durationMinutes(30).bufferMinutes(15).build()).getId();
    }

    private static LocalDateTime at(int hour, int minute) {
        return DAY.atTime(hour, minute);
    }

    @Test
    void endTimeIsStartPlusDurationPlusBuffer() {
        Long id = scheduler.book(clientId, fadeId, at(9, 0));

        AppointmentView view = scheduler.getAppointment(id).orElseThrow();
        assertThat(view.startTime()).isEqualTo(at(9, 0));
        assertThat(view.endTime()).isEqualTo(at(9, 45));
        assertThat(view.serviceDuration()).isEqualTo(30);
        assertThat(view.serviceBuffer()).isEqualTo(15);
    }

    @Test
    void backToBackAppointmentsDoNotConflict() {
        Long first = scheduler.book(clientId, haircutId, at(10, 0));
        Long second = scheduler.book(clientId, haircutId, at(10, 30));

        assertThat(first).isNotEqualTo(second);
        assertThat(appointmentRepository.count()).isEqualTo(2);
    }

    @Test
    void bookingEndingExactlyAtExistingStartIsAllowed() {
        scheduler.book(clientId, haircutId, at(10, 0));

        scheduler.book(clientId, haircutId, at(9, 30));

        assertThat(scheduler.listForDate(DAY))
                .extracting(AppointmentView::startTime)
                .containsExactly(at(9, 30), at(10, 0));
    }

    @Test
    void overlappingBookingIsRejectedAndStoreUnchanged() {
        Long existing = appointmentRepository.save(Appointment.builder()
                .client(clientRepository.findById(clientId).orElseThrow())
                .service(serviceRepository.findById(haircutId).orElseThrow())
                .startTime(at(10, 0))
                .endTime(at(11, 0))
                .build()).getId();

        assertThatThrownBy(() -> scheduler.book(clientId, haircutId, at(10, 30)))
                .isInstanceOf(TimeSlotUnavailableException.class)
                .hasMessageContaining("10:30 AM")
                .satisfies(e -> {
                    TimeSlotUnavailableException conflict = (TimeSlotUnavailableException) e;
                    assertThat(conflict.getStart()).isEqualTo(at(10, 30));
                    assertThat(conflict.getEnd()).isEqualTo(at(11, 0));
                    assertThat(conflict.getConflictingIds()).containsExactly(existing);
                    assertThat(conflict.getOccupiedStart()).isEqualTo(at(10, 0));
                    assertThat(conflict.getOccupiedEnd()).isEqualTo(at(11, 0));
                });

        assertThat(appointmentRepository.count()).isEqualTo(1);
    }

    @Test
    void bookingThatContainsAnExistingAppointmentIsRejected() {
        scheduler.book(clientId, haircutId, at(10, 0));
        Long longService = catalog.create(new ServiceRequest("Color Treatment", new BigDecimal("90"), 120, 0));

        assertThatThrownBy(() -> scheduler.book(clientId, longService, at(9, 0)))
                .isInstanceOf(TimeSlotUnavailableException.class);
    }

    @Test
    void unknownServiceIsRejectedEvenWhenTheSlotIsFree() {
        assertThatThrownBy(() -> scheduler.book(clientId, 987654L, at(8, 0)))
                .isInstanceOf(InvalidAppointmentException.class)
                .isNotInstanceOf(TimeSlotUnavailableException.class)
                .hasMessageContaining("987654");

        assertThat(appointmentRepository.count()).isZero();
    }

    @Test
    void unknownServiceIsReportedBeforeAConflict() {
        scheduler.book(clientId, haircutId, at(10, 0));

        assertThatThrownBy(() -> scheduler.book(clientId, 987654L, at(10, 0)))
                .isInstanceOf(InvalidAppointmentException.class)
                .isNotInstanceOf(TimeSlotUnavailableException.class);
        assertThat(appointmentRepository.count()).isEqualTo(1);
    }

    @Test
    void notesLongerThanTheLimitAreRejected() {
        BookingRequest request = new BookingRequest(clientId, haircutId, at(9, 0), false, "", "x".repeat(501));

        assertThatThrownBy(() -> scheduler.book(request))
                .isInstanceOf(InvalidAppointmentException.class)
                .hasMessage("Notes cannot exceed 500 characters");
        assertThat(appointmentRepository.count()).isZero();
    }

    @Test
    void overlongPaymentMethodIsRejectedBeforeTheInsert() {
        String method = "Gift card ending 1234 redeemed plus remainder in cash";
        BookingRequest request = new BookingRequest(clientId, haircutId, at(9, 0), true, method, "");

        assertThatThrownBy(() -> scheduler.book(request))
                .isInstanceOf(InvalidAppointmentException.class)
                .hasMessage("Payment method cannot exceed 50 characters");
        assertThat(appointmentRepository.count()).isZero();
    }

    @Test
    void storeFailureIsWrappedAndNothingIsWritten() {
        scheduler.book(clientId, haircutId, at(8, 0));

        assertThatThrownBy(() -> scheduler.book(999999L, haircutId, at(9, 0)))
                .isInstanceOf(SchedulerException.class)
                .isNotInstanceOf(InvalidAppointmentException.class)
                .hasMessageStartingWith("Failed to book appointment")
                .satisfies(e -> assertThat(e.getCause()).isNotNull());

        assertThat(appointmentRepository.count()).isEqualTo(1);
        assertThat(scheduler.isTimeAvailable(at(9, 0), at(9, 30))).isTrue();
    }

    @Test
    void paidFlagPaymentMethodAndNotesAreStored() {
        Long id = scheduler.book(new BookingRequest(clientId, haircutId, at(14, 0), true, "Cash", "  Low fade, #2 on top  "));

        AppointmentView view = scheduler.getAppointment(id).orElseThrow();
        assertThat(view.paid()).isTrue();
        assertThat(view.paymentMethod()).isEqualTo("Cash");
        assertThat(view.notes()).isEqualTo("Low fade, #2 on top");
        assertThat(view.clientName()).isEqualTo("Marcus Reed");
        assertThat(view.clientPhone()).isEqualTo("(555) 123-4567");
        assertThat(view.serviceName()).isEqualTo("Haircut");
        assertThat(view.servicePrice()).isEqualByComparingTo("35.00");
    }

    @Test
    void availabilityHonoursExcludedAppointment() {
        Long x = scheduler.book(clientId, haircutId, at(10, 0));

        assertThat(scheduler.isTimeAvailable(at(10, 0), at(10, 30))).isFalse();
        assertThat(scheduler.isTimeAvailable(at(10, 0), at(10, 30), x)).isTrue();

        Long y = scheduler.book(clientId, haircutId, at(10, 30));
        assertThat(scheduler.isTimeAvailable(at(10, 15), at(10, 45), x)).isFalse();
        assertThat(scheduler.isTimeAvailable(at(10, 15), at(10, 45), y)).isFalse();
        assertThat(scheduler.isTimeAvailable(at(11, 0), at(11, 30))).isTrue();
    }

    @Test
    void availabilityRejectsAnEmptyOrReversedInterval() {
        assertThatThrownBy(() -> scheduler.isTimeAvailable(at(10, 0), at(10, 0)))
                .isInstanceOf(InvalidAppointmentException.class);
        assertThatThrownBy(() -> scheduler.isTimeAvailable(at(11, 0), at(10, 0)))
                .isInstanceOf(InvalidAppointmentException.class);
    }

    @Test
    void togglePaidTwiceRestoresOriginalValue() {
        Long id = scheduler.book(clientId, haircutId, at(9, 0));

        assertThat(scheduler.togglePaid(id)).isTrue();
        assertThat(scheduler.getAppointment(id).orElseThrow().paid()).isTrue();

        assertThat(scheduler.togglePaid(id)).isFalse();
        assertThat(scheduler.getAppointment(id).orElseThrow().paid()).isFalse();
    }

    @Test
    void togglePaidOnMissingAppointmentFails() {
        assertThatThrownBy(() -> scheduler.togglePaid(424242L))
                .isInstanceOf(AppointmentNotFoundException.class)
                .isInstanceOf(InvalidAppointmentException.class);
    }

    @Test
    void deleteRemovesPermanently() {
        Long id = scheduler.book(clientId, haircutId, at(9, 0));

        scheduler.delete(id);

        assertThat(scheduler.getAppointment(id)).isEmpty();
        assertThat(scheduler.listForDate(DAY)).isEmpty();
        assertThatThrownBy(() -> scheduler.delete(id)).isInstanceOf(AppointmentNotFoundException.class);
    }

    @Test
    void deletedSlotCanBeBookedAgain() {
        Long id = scheduler.book(clientId, haircutId, at(9, 0));
        scheduler.delete(id);

        assertThat(scheduler.book(clientId, haircutId, at(9, 15))).isNotNull();
    }

    @Test
    void getAppointmentReturnsEmptyWhenMissing() {
        assertThat(scheduler.getAppointment(31337L)).isEqualTo(Optional.empty());
    }

    @Test
    void listForDateOnlyReturnsThatDayInStartOrder() {
        scheduler.book(clientId, haircutId, at(15, 0));
        scheduler.book(clientId, haircutId, at(9, 0));
        scheduler.book(clientId, haircutId, DAY.plusDays(1).atTime(0, 0));
        scheduler.book(clientId, haircutId, DAY.minusDays(1).atTime(23, 0));

        assertThat(scheduler.listForDate(DAY))
                .extracting(AppointmentView::startTime)
                .containsExactly(at(9, 0), at(15, 0));
    }

    @Test
    void editingAServiceDoesNotChangeBookedEndTimes() {
        Long id = scheduler.book(clientId, haircutId, at(9, 0));

        catalog.update(haircutId, new ServiceRequest(null, null, 60, 10));

        AppointmentView view = scheduler.getAppointment(id).orElseThrow();
        assertThat(view.endTime()).isEqualTo(at(9, 30));
        assertThat(view.serviceDuration()).isEqualTo(60);
    }

    @Test
    void rescheduleKeepsBookedLengthAndIgnoresItself() {
        Long id = scheduler.book(clientId, fadeId, at(9, 0));

        AppointmentView moved = scheduler.reschedule(id, at(9, 15));

        assertThat(moved.startTime()).isEqualTo(at(9, 15));
        assertThat(moved.endTime()).isEqualTo(at(10, 0));
        assertThat(scheduler.getAppointment(id).orElseThrow().endTime()).isEqualTo(at(10, 0));
    }

    @Test
    void rescheduleIntoAnotherAppointmentIsRejected() {
        Long first = scheduler.book(clientId, haircutId, at(9, 0));
        Long second = scheduler.book(clientId, haircutId, at(11, 0));

        assertThatThrownBy(() -> scheduler.reschedule(second, at(9, 15)))
                .isInstanceOf(TimeSlotUnavailableException.class)
                .satisfies(e -> assertThat(((TimeSlotUnavailableException) e).getConflictingIds()).containsExactly(first));

        assertThat(scheduler.getAppointment(second).orElseThrow().startTime()).isEqualTo(at(11, 0));
    }

    @Test
    void rescheduleOfMissingAppointmentFails() {
        assertThatThrownBy(() -> scheduler.reschedule(5150L, at(9, 0)))
                .isInstanceOf(AppointmentNotFoundException.class);
    }

    @Test
    void fullDayScenario() {
        Long appt1 = scheduler.book(clientId, haircutId, at(9, 0));
        assertThat(scheduler.getAppointment(appt1).orElseThrow().endTime()).isEqualTo(at(9, 30));

        assertThatThrownBy(() -> scheduler.book(clientId, haircutId, at(9, 15)))
                .isInstanceOf(TimeSlotUnavailableException.class);

        Long appt2 = scheduler.book(clientId, haircutId, at(9, 30));
        assertThat(scheduler.getAppointment(appt2).orElseThrow().endTime()).isEqualTo(at(10, 0));

        assertThat(scheduler.listForDate(DAY))
                .extracting(AppointmentView::appointmentId)
                .containsExactly(appt1, appt2);

        assertThat(scheduler.togglePaid(appt1)).isTrue();

        scheduler.delete(appt2);
        assertThat(scheduler.listForDate(DAY))
                .extracting(AppointmentView::appointmentId)
                .containsExactly(appt1);
    }

    @Test
    void storedAppointmentsNeverOverlapAfterManyAttempts() {
        int[] starts = {540, 550, 560, 570, 585, 600, 615, 620, 645, 660, 665, 690, 700, 720};
        for (int minute : starts) {
            try {
                scheduler.book(clientId, minute % 2 == 0 ? haircutId : fadeId, DAY.atStartOfDay().plusMinutes(minute));
            } catch (TimeSlotUnavailableException expected) {
                // rejected attempts leave the store untouched
            }
        }

        List<Appointment> all = appointmentRepository.findAll();
        assertThat(all).isNotEmpty();
        for (Appointment a : all) {
            for (Appointment b : all) {
                if (!a.getId().equals(b.getId())) {
                    boolean overlap = a.getStartTime().isBefore(b.getEndTime()) && b.getStartTime().isBefore(a.getEndTime());
                    assertThat(overlap).as("%s overlaps %s", a.getId(), b.getId()).isFalse();
                }
            }
        }
    }

    @Test
    void concurrentBookingsOfOneSlotYieldExactlyOneAppointment() throws Exception {
        int threads = 6;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch ready = new CountDownLatch(threads);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<Long>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                int offset = i * 5;
                Callable<Long> attempt = () -> {
                    ready.countDown();
                    go.await();
                    return scheduler.book(clientId, haircutId, at(13, offset));
                };
                results.add(pool.submit(attempt));
            }
            assertThat(ready.await(10, TimeUnit.SECONDS)).isTrue();
            go.countDown();

            int booked = 0;
            int conflicts = 0;
            for (Future<Long> f : results) {
                try {
                    f.get(30, TimeUnit.SECONDS);
                    booked++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(TimeSlotUnavailableException.class);
                    conflicts++;
                }
            }

            assertThat(booked).isEqualTo(1);
            assertThat(conflicts).isEqualTo(threads - 1);
            assertThat(appointmentRepository.count()).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
