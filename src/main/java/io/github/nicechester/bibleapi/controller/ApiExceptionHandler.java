package io.github.nicechester.bibleapi.controller;

import io.github.nicechester.bibleapi.service.ResourceNotFoundException;
import io.github.nicechester.bibleapi.source.BibleSourceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

/**
 * Maps service failures to {@code {"error": "..."}} bodies.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(ResourceNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    /**
     * A non-numeric chapter cannot name any chapter.
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, String>> badPathValue(MethodArgumentTypeMismatchException e) {
        return error(HttpStatus.NOT_FOUND, "not found");
    }

    @ExceptionHandler(BibleSourceException.class)
    public ResponseEntity<Map<String, String>> sourceUnavailable(BibleSourceException e) {
        log.error("Bible source unavailable: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}
