package com.chairman.salon.repository;

import com.chairman.salon.entity.ScheduleLock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.Optional;

@Repository
public interface ScheduleLockRepository extends JpaRepository<ScheduleLock, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM ScheduleLock l WHERE l.name = :name")
    Optional<ScheduleLock> findByNameForUpdate(@Param("name") String name);
}
