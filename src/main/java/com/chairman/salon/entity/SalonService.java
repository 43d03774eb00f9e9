package com.chairman.salon.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

/**
 * An offered service (haircut, beard trim, ...). Duration and buffer are read
 * when an appointment is booked and copied into its end time.
 */
@Entity
@Table(name = "services")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SalonService {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "duration_minutes", nullable = false)
    private int durationMinutes;

    /** Cleanup time reserved after the service, part of the same appointment. */
    @Column(name = "buffer_minutes", nullable = false)
    private int bufferMinutes;

    public int totalMinutes() {
        return durationMinutes + bufferMinutes;
    }
}
