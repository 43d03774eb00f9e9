package com.chairman.salon.config;

import com.chairman.salon.exception.AppointmentNotFoundException;
import com.chairman.salon.exception.ClientDirectoryException;
import com.chairman.salon.exception.DuplicateClientException;
import com.chairman.salon.exception.DuplicateServiceException;
import com.chairman.salon.exception.InvalidAppointmentException;
import com.chairman.salon.exception.InvalidClientDataException;
import com.chairman.salon.exception.InvalidServiceDataException;
import com.chairman.salon.exception.SchedulerException;
import com.chairman.salon.exception.ServiceCatalogException;
import com.chairman.salon.exception.TimeSlotUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps the error kinds to HTTP: invalid input 400, not found 404,
 * conflicts and duplicates 409, anything else 500.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(AppointmentNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(AppointmentNotFoundException e) {
        return body(HttpStatus.NOT_FOUND, "not_found", e.getMessage());
    }

    @ExceptionHandler(TimeSlotUnavailableException.class)
    public ResponseEntity<Map<String, Object>> conflict(TimeSlotUnavailableException e) {
        ResponseEntity<Map<String, Object>> response = body(HttpStatus.CONFLICT, "conflict", e.getMessage());
        Map<String, Object> window = new LinkedHashMap<>();
        window.put("start", e.getStart().toString());
        window.put("end", e.getEnd().toString());
        window.put("conflictingIds", e.getConflictingIds());
        if (e.getOccupiedStart() != null) {
            window.put("occupiedStart", e.getOccupiedStart().toString());
            window.put("occupiedEnd", e.getOccupiedEnd().toString());
        }
        response.getBody().put("window", window);
        return response;
    }

    @ExceptionHandler({InvalidAppointmentException.class, InvalidServiceDataException.class, InvalidClientDataException.class})
    public ResponseEntity<Map<String, Object>> invalid(RuntimeException e) {
        return body(HttpStatus.BAD_REQUEST, "invalid_input", e.getMessage());
    }

    @ExceptionHandler({DuplicateServiceException.class, DuplicateClientException.class})
    public ResponseEntity<Map<String, Object>> duplicate(RuntimeException e) {
        return body(HttpStatus.CONFLICT, "duplicate", e.getMessage());
    }

    @ExceptionHandler({ServiceCatalogException.class, ClientDirectoryException.class})
    public ResponseEntity<Map<String, Object>> rejected(RuntimeException e) {
        if (e.getCause() == null) {
            return body(HttpStatus.CONFLICT, "rejected", e.getMessage());
        }
        log.error("Request failed", e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "storage_failure", e.getMessage());
    }

    @ExceptionHandler(SchedulerException.class)
    public ResponseEntity<Map<String, Object>> schedulerFailure(SchedulerException e) {
        log.error("Scheduler failure", e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "storage_failure", e.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
