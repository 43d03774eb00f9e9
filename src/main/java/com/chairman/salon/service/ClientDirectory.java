package com.chairman.salon.service;

import com.chairman.salon.dto.ClientRequest;
import com.chairman.salon.dto.ValidationResult;
import com.chairman.salon.entity.Client;
import com.chairman.salon.exception.ClientDirectoryException;
import com.chairman.salon.exception.DuplicateClientException;
import com.chairman.salon.exception.InvalidClientDataException;
import com.chairman.salon.repository.AppointmentRepository;
import com.chairman.salon.repository.ClientRepository;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class ClientDirectory {

    private static final Logger log = LoggerFactory.getLogger(ClientDirectory.class);

    private final ClientRepository clientRepository;
    private final AppointmentRepository appointmentRepository;
    private final InputValidator validator;

    @Transactional
    public Long create(ClientRequest request) {
        require(validator.validateClientName(request.getName()));
        require(validator.validatePhone(request.getPhone()));

        String name = validator.sanitizeInput(request.getName());
        String phone = validator.sanitizeInput(request.getPhone());
        String notes = validator.sanitizeInput(request.getNotes());

        if (clientRepository.existsByNameIgnoreCase(name)) {
            log.warn("Attempted to create duplicate client: {}", name);
            throw new DuplicateClientException(name);
        }

        try {
            Client client = clientRepository.saveAndFlush(Client.builder()
                    .name(name)
                    .phone(validator.formatPhone(phone))
                    .notes(notes)
                    .build());
            log.info("Created client: {} (ID: {})", name, client.getId());
            return client.getId();
        } catch (DataAccessException e) {
            log.error("Error creating client {}", name, e);
            throw new ClientDirectoryException("Failed to create client: " + e.getMessage(), e);
        }
    }

    @Transactional(readOnly = true)
    public List<Client> all() {
        return clientRepository.findAllByOrderByNameAsc();
    }

    @Transactional(readOnly = true)
    public Optional<Client> get(Long clientId) {
        return clientRepository.findById(clientId);
    }

    /** Name or phone contains the query, case-insensitive on the name. */
    @Transactional(readOnly = true)
    public List<Client> search(String query) {
        String q = StringUtils.trimToEmpty(query);
        List<Client> found = clientRepository.findByNameContainingIgnoreCaseOrPhoneContainingOrderByNameAsc(q, q);
        log.debug("Search for '{}' returned {} clients", q, found.size());
        return found;
    }

    @Transactional
    public Client update(Long clientId, ClientRequest request) {
        Client client = clientRepository.findById(clientId)
                .orElseThrow(() -> new InvalidClientDataException("Client with ID " + clientId + " does not exist"));

        if (request.getName() != null) {
            require(validator.validateClientName(request.getName()));
            client.setName(validator.sanitizeInput(request.getName()));
        }
        if (request.getPhone() != null) {
            require(validator.validatePhone(request.getPhone()));
            client.setPhone(validator.formatPhone(validator.sanitizeInput(request.getPhone())));
        }
        if (request.getNotes() != null) {
            client.setNotes(validator.sanitizeInput(request.getNotes()));
        }

        try {
            client = clientRepository.saveAndFlush(client);
        } catch (DataAccessException e) {
            log.error("Error updating client {}", clientId, e);
            throw new ClientDirectoryException("Failed to update client: " + e.getMessage(), e);
        }
        log.info("Updated client {}", clientId);
        return client;
    }

    @Transactional
    public void delete(Long clientId) {
        long booked = appointmentRepository.countByClientId(clientId);
        if (booked > 0) {
            throw new ClientDirectoryException("Cannot delete client with existing appointments. "
                    + "This client has " + booked + " appointment(s).");
        }
        if (!clientRepository.existsById(clientId)) {
            throw new InvalidClientDataException("Client with ID " + clientId + " does not exist");
        }
        try {
            clientRepository.deleteById(clientId);
            clientRepository.flush();
        } catch (DataAccessException e) {
            log.error("Error deleting client {}", clientId, e);
            throw new ClientDirectoryException("Failed to delete client: " + e.getMessage(), e);
        }
        log.info("Deleted client {}", clientId);
    }

    @Transactional
    public void incrementNoShow(Long clientId) {
        if (clientRepository.incrementNoShowCount(clientId) == 0) {
            throw new InvalidClientDataException("Client with ID " + clientId + " does not exist");
        }
        log.info("Incremented no-show count for client {}", clientId);
    }

    private static void require(ValidationResult result) {
        if (!result.valid()) {
            throw new InvalidClientDataException(result.errorMessage());
        }
    }
}
