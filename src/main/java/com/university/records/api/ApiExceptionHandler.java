package com.university.records.api;

import com.university.records.error.RecordsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(RecordsException.class)
    public ResponseEntity<ErrorResponse> handle(RecordsException e) {
        HttpStatus status = switch (e.kind()) {
            case RECORD_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case DUPLICATE_ENROLLMENT, CAPACITY_EXCEEDED, DATABASE_ERROR -> HttpStatus.CONFLICT;
            case PREREQUISITE_NOT_MET -> HttpStatus.UNPROCESSABLE_ENTITY;
            case INVALID_EMAIL, UNSUPPORTED_DATE_FORMAT, INCORRECT_TIMESLOT, INCORRECT_VALUE -> HttpStatus.BAD_REQUEST;
        };
        log.debug("{} -> {}: {}", e.kind(), status.value(), e.getMessage());
        return ResponseEntity.status(status).body(new ErrorResponse(e.kind().name(), e.getMessage()));
    }

    public record ErrorResponse(String kind, String message) {}
}
