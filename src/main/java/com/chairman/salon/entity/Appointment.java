package com.chairman.salon.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * A booked interval {@code [startTime, endTime)}. The end time is fixed at
 * booking time and does not follow later edits of the service.
 */
@Entity
@Table(name = "appointments", indexes = {
    @Index(name = "idx_appointments_start", columnList = "start_time"),
    @Index(name = "idx_appointments_end", columnList = "end_time")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Appointment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "client_id", nullable = false)
    private Client client;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "service_id", nullable = false)
    private SalonService service;

    @Column(name = "start_time", nullable = false)
    private LocalDateTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalDateTime endTime;

    @Column(nullable = false)
    private boolean paid;

    @Column(name = "payment_method", length = 50)
    @Builder.Default
    private String paymentMethod = "";

    @Column(length = 1000)
    @Builder.Default
    private String notes = "";
}
