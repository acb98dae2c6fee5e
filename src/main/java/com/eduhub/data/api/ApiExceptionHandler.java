package com.eduhub.data.api;

import com.eduhub.data.error.AggregationException;
import com.eduhub.data.error.ConnectivityException;
import com.eduhub.data.error.DuplicateRecordException;
import com.eduhub.data.error.IndexConflictException;
import com.eduhub.data.error.NotFoundException;
import com.eduhub.data.error.SchemaApplicationException;
import com.eduhub.data.error.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, "Not found", ex);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleInvalid(ValidationException ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Validation failed", ex);
    }

    @ExceptionHandler({DuplicateRecordException.class, IndexConflictException.class})
    public ResponseEntity<Map<String, Object>> handleConflict(RuntimeException ex) {
        log.warn("Uniqueness conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, "Conflict", ex);
    }

    @ExceptionHandler(ConnectivityException.class)
    public ResponseEntity<Map<String, Object>> handleUnavailable(ConnectivityException ex) {
        log.error("Store unavailable", ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Store unavailable", ex);
    }

    @ExceptionHandler({SchemaApplicationException.class, AggregationException.class})
    public ResponseEntity<Map<String, Object>> handleStoreRejection(RuntimeException ex) {
        log.error("Store rejected request", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Store rejected request", ex);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, Object>> handleUnclassified(DataAccessException ex) {
        log.error("Unclassified store failure", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Store failure", ex);
    }

    private ResponseEntity<Map<String, Object>> respond(HttpStatus status, String error, RuntimeException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", ex.getMessage());
        body.put("status", status.value());
        return ResponseEntity.status(status).body(body);
    }
}
