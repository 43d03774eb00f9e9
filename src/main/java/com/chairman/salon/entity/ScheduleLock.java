package com.chairman.salon.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Single-row table locked with {@code SELECT ... FOR UPDATE} so that the
 * availability check and the write of a booking are serialised until commit.
 */
@Entity
@Table(name = "schedule_lock")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleLock {

    public static final String APPOINTMENTS = "appointments";

    @Id
    @Column(length = 50)
    private String name;
}
