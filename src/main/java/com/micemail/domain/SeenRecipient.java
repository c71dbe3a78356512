package com.micemail.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Recipient address that has been accepted at least once
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeenRecipient {

    private Long id;
    private String email;
    private String createdDt;
}
