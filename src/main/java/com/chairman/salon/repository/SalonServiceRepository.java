package com.chairman.salon.repository;

import com.chairman.salon.entity.SalonService;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SalonServiceRepository extends JpaRepository<SalonService, Long> {

    List<SalonService> findAllByOrderByNameAsc();

    boolean existsByNameIgnoreCase(String name);
}
