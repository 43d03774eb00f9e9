package com.chairman.salon.controller;

import com.chairman.salon.dto.ClientRequest;
import com.chairman.salon.entity.Client;
import com.chairman.salon.service.ClientDirectory;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/clients")
@RequiredArgsConstructor
public class ClientController {

    private final ClientDirectory directory;

    @GetMapping
    public List<Client> all(@RequestParam(value = "q", required = false) String query) {
        return StringUtils.hasText(query) ? directory.search(query) : directory.all();
    }

    @GetMapping("/{id}")
    public ResponseEntity<Client> get(@PathVariable("id") Long id) {
        return directory.get(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping
    public ResponseEntity<Map<String, Long>> create(@RequestBody ClientRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("id", directory.create(request)));
    }

    @PutMapping("/{id}")
    public Client update(@PathVariable("id") Long id, @RequestBody ClientRequest request) {
        return directory.update(id, request);
    }

    @PostMapping("/{id}/no-shows")
    public ResponseEntity<Void> recordNoShow(@PathVariable("id") Long id) {
        directory.incrementNoShow(id);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") Long id) {
        directory.delete(id);
        return ResponseEntity.noContent().build();
    }
}
