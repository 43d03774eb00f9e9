package com.chairman.salon.repository;

import com.chairman.salon.entity.Client;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ClientRepository extends JpaRepository<Client, Long> {

    List<Client> findAllByOrderByNameAsc();

    boolean existsByNameIgnoreCase(String name);

    List<Client> findByNameContainingIgnoreCaseOrPhoneContainingOrderByNameAsc(String name, String phone);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE Client c SET c.noShowCount = c.noShowCount + 1 WHERE c.id = :id")
    int incrementNoShowCount(@Param("id") Long id);
}
