package com.contractradar.api.controller;

import com.contractradar.api.dto.ErrorBody;
import com.contractradar.api.validation.InvalidAddressException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps request validation failures to 400 with ErrorBody (error, message, timestamp).
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidAddressException.class)
    public ResponseEntity<ErrorBody> handleInvalidAddress(InvalidAddressException ex) {
        log.debug("Rejected address: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ErrorBody.of(ex.getCode(), ex.getMessage()));
    }
}
