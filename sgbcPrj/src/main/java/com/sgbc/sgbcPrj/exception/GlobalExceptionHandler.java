package com.sgbc.sgbcPrj.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(CirculationException.class)
    public ResponseEntity<Map<String, Object>> handleCirculation(CirculationException e) {
        return body(e.getCode().getHttpStatus(), e.getCode().name(), e.getMessage());
    }

    /** UNIQUE(email), UNIQUE(library_id, code) */
    @ExceptionHandler(DuplicateKeyException.class)
    public ResponseEntity<Map<String, Object>> handleDuplicate(DuplicateKeyException e) {
        log.warn("duplicate key rejected: {}", e.getMostSpecificCause().getMessage());
        return body(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_FAILED.name(), "Duplicate value");
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<Map<String, Object>> handleMalformed(Exception e) {
        return body(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_FAILED.name(), "Malformed request");
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, String code, String message) {
        return ResponseEntity
                .status(status)
                .body(Map.of(
                        "code", code,
                        "message", message == null ? "" : message
                ));
    }
}
