package com.roadspeed.engine.controller;

import com.roadspeed.engine.exception.RefreshCancelledException;
import com.roadspeed.engine.exception.StoreUnavailableException;
import com.roadspeed.engine.exception.UnknownSegmentException;
import com.roadspeed.engine.exception.ValidationFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps service exceptions to JSON error bodies.
 *
 * Body shape: {"status": "REJECTED" | "UNAVAILABLE" | "CANCELLED", "error": CODE, "message": text}
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(ValidationFailedException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationFailedException ex) {
        log.warn("Rejected input: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "REJECTED", "VALIDATION_FAILED", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleBeanValidation(MethodArgumentNotValidException ex) {
        List<String> details = ex.getBindingResult().getFieldErrors().stream()
            .map(FieldError::getDefaultMessage)
            .toList();
        log.warn("Rejected request body: {}", details);

        Map<String, Object> body = body("REJECTED", "VALIDATION_FAILED", String.join("; ", details));
        body.put("details", details);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleUnreadable(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "REJECTED", "MALFORMED_REQUEST", ex.getMessage());
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<Map<String, Object>> handleConstraintViolation(DataIntegrityViolationException ex) {
        log.warn("Rejected by a database constraint: {}", ex.getMostSpecificCause().getMessage());
        return error(HttpStatus.BAD_REQUEST, "REJECTED", "VALIDATION_FAILED",
            "Rejected by a database constraint: " + ex.getMostSpecificCause().getMessage());
    }

    @ExceptionHandler(UnknownSegmentException.class)
    public ResponseEntity<Map<String, Object>> handleUnknownSegment(UnknownSegmentException ex) {
        log.warn("Observation for unknown segment {}", ex.getSegmentId());
        Map<String, Object> body = body("REJECTED", "UNKNOWN_SEGMENT", ex.getMessage());
        body.put("segmentId", ex.getSegmentId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
    }

    @ExceptionHandler({
        StoreUnavailableException.class,
        DataAccessResourceFailureException.class,
        CannotCreateTransactionException.class
    })
    public ResponseEntity<Map<String, Object>> handleStoreUnavailable(Exception ex) {
        log.error("Store unavailable", ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "UNAVAILABLE", "STORE_UNAVAILABLE", ex.getMessage());
    }

    @ExceptionHandler(RefreshCancelledException.class)
    public ResponseEntity<Map<String, Object>> handleCancelled(RefreshCancelledException ex) {
        return error(HttpStatus.CONFLICT, "CANCELLED", "REFRESH_CANCELLED", ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String outcome, String code, String message) {
        return ResponseEntity.status(status).body(body(outcome, code, message));
    }

    private static Map<String, Object> body(String outcome, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", outcome);
        body.put("error", code);
        body.put("message", message);
        return body;
    }
}
