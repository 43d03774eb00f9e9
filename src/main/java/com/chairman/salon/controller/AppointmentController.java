package com.chairman.salon.controller;

import com.chairman.salon.dto.AppointmentView;
import com.chairman.salon.dto.BookingRequest;
import com.chairman.salon.dto.RescheduleRequest;
import com.chairman.salon.service.AppointmentScheduler;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/appointments")
@RequiredArgsConstructor
public class AppointmentController {

    private final AppointmentScheduler scheduler;

    @GetMapping
    public List<AppointmentView> listForDate(
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return scheduler.listForDate(date);
    }

    @GetMapping("/{id}")
    public ResponseEntity<AppointmentView> get(@PathVariable("id") Long id) {
        return scheduler.getAppointment(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/availability")
    public Map<String, Boolean> availability(
            @RequestParam("start") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime start,
            @RequestParam("end") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime end,
            @RequestParam(value = "excludeId", required = false) Long excludeId) {
        return Map.of("available", scheduler.isTimeAvailable(start, end, excludeId));
    }

    @PostMapping
    public ResponseEntity<Map<String, Long>> book(@RequestBody BookingRequest request) {
        Long id = scheduler.book(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("id", id));
    }

    @PatchMapping("/{id}/paid")
    public Map<String, Boolean> togglePaid(@PathVariable("id") Long id) {
        return Map.of("paid", scheduler.togglePaid(id));
    }

    @PatchMapping("/{id}/start")
    public AppointmentView reschedule(@PathVariable("id") Long id, @RequestBody RescheduleRequest request) {
        return scheduler.reschedule(id, request.start());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") Long id) {
        scheduler.delete(id);
        return ResponseEntity.noContent().build();
    }
}
