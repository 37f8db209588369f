package com.ricemill.stockkeeper.config;

import com.ricemill.stockkeeper.exception.*;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps the error taxonomy to HTTP. Access failures share one fixed body so a
 * caller cannot tell a foreign tenant from a missing permission.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<Map<String, Object>> handleUnauthorized(HttpServletRequest request, UnauthorizedException ex) {
        log.debug("Access denied on {}: {}", request.getRequestURI(), ex.getMessage());
        return body(HttpStatus.FORBIDDEN, "Access denied");
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex) {
        return body(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler({ InvalidPeriodException.class, IllegalArgumentException.class })
    public ResponseEntity<Map<String, Object>> handleBadRequest(RuntimeException ex) {
        return body(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return body(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler(DegradedDataException.class)
    public ResponseEntity<Map<String, Object>> handleDegraded(DegradedDataException ex) {
        return body(HttpStatus.SERVICE_UNAVAILABLE, "Data temporarily unavailable");
    }

    @ExceptionHandler(ComputationException.class)
    public ResponseEntity<Map<String, Object>> handleComputation(ComputationException ex) {
        log.error("Metric computation failed", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Metric could not be computed");
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
