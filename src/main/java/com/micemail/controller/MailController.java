package com.micemail.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.micemail.config.MicemailProperties;
import com.micemail.dispatch.DispatchMode;
import com.micemail.dispatch.DispatchOutcome;
import com.micemail.dispatch.DispatchService;
import com.micemail.domain.OutboundMail;
import com.micemail.domain.SeenRecipient;
import com.micemail.domain.SendRequest;
import com.micemail.exception.ValidationException;
import com.micemail.service.MailService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Mail submission REST API
 * - Send mail (POST /send-email)
 * - List recorded recipients (GET /get-all-emails)
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class MailController {

    static final String SENT = "Email sent successfully";
    static final String PROCESSING = "Email is being processed";
    static final String FAILED = "Failed to send email after multiple attempts";

    private final MailService mailService;
    private final DispatchService dispatchService;
    private final MicemailProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * Send mail
     * POST /send-email
     * Body: { "subject": "Hi", "message": "Body", "recipients": ["a@b.co"] }
     * SYNC: 200 on delivery, 500 when retries are exhausted. ASYNC: 202.
     * The body is decoded as JSON whatever Content-Type the caller sent.
     */
    @PostMapping("/send-email")
    public ResponseEntity<String> sendEmail(InputStream body) {
        OutboundMail mail = mailService.prepare(readRequest(body));

        if (properties.getDispatch().getMode() == DispatchMode.ASYNC) {
            dispatchService.submit(mail);
            return text(HttpStatus.ACCEPTED, PROCESSING);
        }

        DispatchOutcome outcome = dispatchService.dispatch(mail);
        if (outcome.isDelivered()) {
            return text(HttpStatus.OK, SENT);
        }
        log.warn("[{}] Reporting failure to caller: {}", mail.getId(), outcome.getLastError().getMessage());
        return text(HttpStatus.INTERNAL_SERVER_ERROR, FAILED + ": " + outcome.getLastError().getMessage());
    }

    /**
     * List recorded recipients
     * GET /get-all-emails
     */
    @GetMapping(value = "/get-all-emails", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<SeenRecipient> getAllEmails() {
        return mailService.listRecipients();
    }

    @RequestMapping(value = "/send-email", method = {RequestMethod.HEAD, RequestMethod.OPTIONS})
    public ResponseEntity<String> sendEmailMethodNotAllowed() {
        return methodNotAllowed("POST");
    }

    @RequestMapping(value = "/get-all-emails", method = {RequestMethod.HEAD, RequestMethod.OPTIONS})
    public ResponseEntity<String> getAllEmailsMethodNotAllowed() {
        return methodNotAllowed("GET");
    }

    // Raw stream: a form Content-Type must not route the body through servlet parameter parsing
    private SendRequest readRequest(InputStream body) {
        SendRequest request;
        try {
            request = objectMapper.readValue(body, SendRequest.class);
        } catch (IOException e) {
            log.info("Malformed request body: {}", e.getMessage());
            throw new ValidationException("Malformed request body");
        }
        if (request == null) {
            throw new ValidationException("Malformed request body");
        }
        return request;
    }

    static ResponseEntity<String> methodNotAllowed(String allowed) {
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
                .header(HttpHeaders.ALLOW, allowed)
                .contentType(MediaType.TEXT_PLAIN)
                .body("Only " + allowed + " method is allowed");
    }

    static ResponseEntity<String> text(HttpStatus status, String body) {
        return ResponseEntity.status(status).contentType(MediaType.TEXT_PLAIN).body(body);
    }
}
