package com.chairman.salon.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/** Create/update payload for a client. Null fields are left unchanged on update. */
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class ClientRequest {

    private String name;

    private String phone;

    private String notes;
}
