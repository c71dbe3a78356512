package com.micemail.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of POST /send-email
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SendRequest {

    private String subject;
    private String message;
    private List<String> recipients;
}
