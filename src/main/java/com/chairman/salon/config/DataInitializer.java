package com.chairman.salon.config;

import com.chairman.salon.entity.SalonService;
import com.chairman.salon.entity.ScheduleLock;
import com.chairman.salon.repository.SalonServiceRepository;
import com.chairman.salon.repository.ScheduleLockRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

/**
 * Idempotent startup data: the schedule lock row, and optionally a starter
 * service catalogue on an empty database. Safe to re-run.
 */
@Component
public class DataInitializer {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    private final ScheduleLockRepository lockRepository;
    private final SalonServiceRepository serviceRepository;

    @Value("${chairman.seed-demo-data:false}")
    private boolean seedDemoData;

    public DataInitializer(ScheduleLockRepository lockRepository,
                           SalonServiceRepository serviceRepository) {
        this.lockRepository = lockRepository;
        this.serviceRepository = serviceRepository;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(1)
    @Transactional
    public void seed() {
        if (!lockRepository.existsById(ScheduleLock.APPOINTMENTS)) {
            lockRepository.save(new ScheduleLock(ScheduleLock.APPOINTMENTS));
            log.info("Created schedule lock row");
        }

        if (!seedDemoData) {
            return;
        }
        if (serviceRepository.count() > 0) {
            log.info("Services already present, skipping demo data");
            return;
        }
        List<SalonService> services = serviceRepository.saveAll(List.of(
                SalonService.builder().name("Haircut").price(new BigDecimal("35.00")).durationMinutes(30).bufferMinutes(0).build(),
                SalonService.builder().name("Beard Trim").price(new BigDecimal("20.00")).durationMinutes(15).bufferMinutes(5).build(),
                SalonService.builder().name("Haircut & Beard").price(new BigDecimal("50.00")).durationMinutes(45).bufferMinutes(15).build()
        ));
        log.info("Seeded {} demo services", services.size());
    }
}
