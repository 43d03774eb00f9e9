package com.chairman.salon.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;

/** Create/update payload for a service. Null fields are left unchanged on update. */
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class ServiceRequest {

    private String name;

    private BigDecimal price;

    private Integer durationMinutes;

    private Integer bufferMinutes;
}
