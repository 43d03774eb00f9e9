package com.chairman.salon.repository;

import com.chairman.salon.entity.Appointment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface AppointmentRepository extends JpaRepository<Appointment, Long> {

    /**
     * Ids of appointments whose interval overlaps {@code [start, end)}.
     * Touching intervals ({@code end == other.start}) do not overlap.
     */
    @Query("SELECT a.id FROM Appointment a "
            + "WHERE NOT (a.endTime <= :start OR a.startTime >= :end) "
            + "ORDER BY a.startTime")
    List<Long> findOverlappingIds(@Param("start") LocalDateTime start,
                                  @Param("end") LocalDateTime end);

    @Query("SELECT a.id FROM Appointment a "
            + "WHERE a.id <> :excludeId AND NOT (a.endTime <= :start OR a.startTime >= :end) "
            + "ORDER BY a.startTime")
    List<Long> findOverlappingIdsExcluding(@Param("start") LocalDateTime start,
                                           @Param("end") LocalDateTime end,
                                           @Param("excludeId") Long excludeId);

    @Query("SELECT a FROM Appointment a JOIN FETCH a.client JOIN FETCH a.service "
            + "WHERE a.startTime >= :from AND a.startTime < :to "
            + "ORDER BY a.startTime ASC")
    List<Appointment> findDetailedByStartTimeBetween(@Param("from") LocalDateTime from,
                                                     @Param("to") LocalDateTime to);

    @Query("SELECT a FROM Appointment a JOIN FETCH a.client JOIN FETCH a.service WHERE a.id = :id")
    Optional<Appointment> findDetailedById(@Param("id") Long id);

    long countByServiceId(Long serviceId);

    long countByClientId(Long clientId);
}
