package com.chairman.salon.service;

import com.chairman.salon.dto.ServiceRequest;
import com.chairman.salon.dto.ValidationResult;
import com.chairman.salon.entity.SalonService;
import com.chairman.salon.exception.DuplicateServiceException;
import com.chairman.salon.exception.InvalidServiceDataException;
import com.chairman.salon.exception.ServiceCatalogException;
import com.chairman.salon.repository.AppointmentRepository;
import com.chairman.salon.repository.SalonServiceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * The services the shop offers, with the price, duration and buffer used when
 * an appointment is booked.
 */
@Service
public class ServiceCatalog {

    private static final Logger log = LoggerFactory.getLogger(ServiceCatalog.class);

    private final SalonServiceRepository serviceRepository;
    private final AppointmentRepository appointmentRepository;
    private final InputValidator validator;

    public ServiceCatalog(SalonServiceRepository serviceRepository,
                          AppointmentRepository appointmentRepository,
                          InputValidator validator) {
        this.serviceRepository = serviceRepository;
        this.appointmentRepository = appointmentRepository;
        this.validator = validator;
    }

    @Transactional
    public Long create(ServiceRequest request) {
        require(validator.validateServiceName(request.getName()));
        require(validator.validatePrice(request.getPrice()));
        require(validator.validateDuration(request.getDurationMinutes()));
        int buffer = request.getBufferMinutes() != null ? request.getBufferMinutes() : 0;
        require(validator.validateBuffer(buffer));

        String name = validator.sanitizeInput(request.getName());
        if (serviceRepository.existsByNameIgnoreCase(name)) {
            log.warn("Attempted to create duplicate service: {}", name);
            throw new DuplicateServiceException(name);
        }

        try {
            SalonService service = serviceRepository.saveAndFlush(SalonService.builder()
                    .name(name)
                    .price(request.getPrice())
                    .durationMinutes(request.getDurationMinutes())
                    .bufferMinutes(buffer)
                    .build());
            log.info("Created service: {} (ID: {}) - ${}, {}min + {}min buffer",
                    name, service.getId(), service.getPrice(), service.getDurationMinutes(), buffer);
            return service.getId();
        } catch (DataAccessException e) {
            log.error("Error creating service {}", name, e);
            throw new ServiceCatalogException("Failed to create service: " + e.getMessage(), e);
        }
    }

    @Transactional(readOnly = true)
    public List<SalonService> all() {
        return serviceRepository.findAllByOrderByNameAsc();
    }

    @Transactional(readOnly = true)
    public Optional<SalonService> get(Long serviceId) {
        return serviceRepository.findById(serviceId);
    }

    /**
     * Applies the non-null fields of the request. Existing appointments keep the
     * end time they were booked with.
     */
    @Transactional
    public SalonService update(Long serviceId, ServiceRequest request) {
        SalonService service = serviceRepository.findById(serviceId)
                .orElseThrow(() -> new InvalidServiceDataException("Service with ID " + serviceId + " does not exist"));

        if (request.getName() != null) {
            require(validator.validateServiceName(request.getName()));
            service.setName(validator.sanitizeInput(request.getName()));
        }
        if (request.getPrice() != null) {
            require(validator.validatePrice(request.getPrice()));
            service.setPrice(request.getPrice());
        }
        if (request.getDurationMinutes() != null) {
            require(validator.validateDuration(request.getDurationMinutes()));
            service.setDurationMinutes(request.getDurationMinutes());
        }
        if (request.getBufferMinutes() != null) {
            require(validator.validateBuffer(request.getBufferMinutes()));
            service.setBufferMinutes(request.getBufferMinutes());
        }

        try {
            service = serviceRepository.saveAndFlush(service);
        } catch (DataAccessException e) {
            log.error("Error updating service {}", serviceId, e);
            throw new ServiceCatalogException("Failed to update service: " + e.getMessage(), e);
        }
        log.info("Updated service {}", serviceId);
        return service;
    }

    @Transactional
    public void delete(Long serviceId) {
        long booked = appointmentRepository.countByServiceId(serviceId);
        if (booked > 0) {
            throw new ServiceCatalogException("Cannot delete service with existing appointments. "
                    + "This service has " + booked + " appointment(s).");
        }
        if (!serviceRepository.existsById(serviceId)) {
            throw new InvalidServiceDataException("Service with ID " + serviceId + " does not exist");
        }
        try {
            serviceRepository.deleteById(serviceId);
            serviceRepository.flush();
        } catch (DataAccessException e) {
            log.error("Error deleting service {}", serviceId, e);
            throw new ServiceCatalogException("Failed to delete service: " + e.getMessage(), e);
        }
        log.info("Deleted service {}", serviceId);
    }

    private static void require(ValidationResult result) {
        if (!result.valid()) {
            throw new InvalidServiceDataException(result.errorMessage());
        }
    }
}
