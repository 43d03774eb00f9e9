package com.chairman.salon.dto;

import java.time.LocalDateTime;

public record RescheduleRequest(LocalDateTime start) {
}
