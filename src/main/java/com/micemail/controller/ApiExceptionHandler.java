package com.micemail.controller;

import com.micemail.exception.StoreException;
import com.micemail.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Maps request failures to plain-text HTTP errors
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<String> handleValidation(ValidationException e) {
        log.info("Request rejected: {}", e.getMessage());
        return MailController.text(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<String> handleMethod(HttpRequestMethodNotSupportedException e) {
        // HEAD and OPTIONS are mapped only to refuse them
        String allowed = e.getSupportedMethods() == null ? "" : Arrays.stream(e.getSupportedMethods())
                .filter(method -> !"HEAD".equals(method) && !"OPTIONS".equals(method))
                .collect(Collectors.joining(", "));
        return MailController.methodNotAllowed(allowed);
    }

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<String> handleStore(StoreException e) {
        log.error("Recipient store failure", e);
        return MailController.text(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }
}
