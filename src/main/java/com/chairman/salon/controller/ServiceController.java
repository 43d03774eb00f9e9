package com.chairman.salon.controller;

import com.chairman.salon.dto.ServiceRequest;
import com.chairman.salon.entity.SalonService;
import com.chairman.salon.service.ServiceCatalog;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/services")
@RequiredArgsConstructor
public class ServiceController {

    private final ServiceCatalog catalog;

    @GetMapping
    public List<SalonService> all() {
        return catalog.all();
    }

    @GetMapping("/{id}")
    public ResponseEntity<SalonService> get(@PathVariable("id") Long id) {
        return catalog.get(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping
    public ResponseEntity<Map<String, Long>> create(@RequestBody ServiceRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("id", catalog.create(request)));
    }

    @PutMapping("/{id}")
    public SalonService update(@PathVariable("id") Long id, @RequestBody ServiceRequest request) {
        return catalog.update(id, request);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") Long id) {
        catalog.delete(id);
        return ResponseEntity.noContent().build();
    }
}
