package org.learningjava.gaugeledger.infrastructure.adapter.in.web;

import org.learningjava.gaugeledger.application.port.StorageConflictException;
import org.learningjava.gaugeledger.application.port.StorageNotOpenException;
import org.learningjava.gaugeledger.domain.error.MalformedExportException;
import org.learningjava.gaugeledger.domain.error.MalformedTaskPathException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.UncheckedIOException;
import java.util.Map;

/** Maps ledger failures to status codes with a {@code {"error": ...}} body. */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(StorageConflictException.class)
    public ResponseEntity<Map<String, String>> conflict(StorageConflictException e) {
        return error(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(StorageNotOpenException.class)
    public ResponseEntity<Map<String, String>> notOpen(StorageNotOpenException e) {
        log.error("Request hit a closed storage handle", e);
        return error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, MalformedExportException.class,
            MalformedTaskPathException.class})
    public ResponseEntity<Map<String, String>> badRequest(RuntimeException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(UncheckedIOException.class)
    public ResponseEntity<Map<String, String>> io(UncheckedIOException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> invalid(MethodArgumentNotValidException e) {
        String msg = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .findFirst()
                .orElse("invalid request");
        return error(HttpStatus.BAD_REQUEST, msg);
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message == null ? status.getReasonPhrase() : message));
    }
}
