package com.wakeengine.service.controller;

import com.wakeengine.common.exception.CollaboratorUnavailableException;
import com.wakeengine.common.exception.NotFoundException;
import com.wakeengine.common.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps the engine's exception taxonomy to HTTP status codes.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", "validation_failed");
        body.put("details", ex.getErrors());
        return new ResponseEntity<>(body, HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", ex.getKind() + "_not_found");
        body.put("details", ex.getId());
        return new ResponseEntity<>(body, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(CollaboratorUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleCollaborator(CollaboratorUnavailableException ex) {
        log.warn("Collaborator unavailable. collaborator={} reason={}", ex.getCollaborator(), ex.getMessage());
        Map<String, Object> body = new HashMap<>();
        body.put("error", "collaborator_unavailable");
        body.put("details", ex.getMessage());
        return new ResponseEntity<>(body, HttpStatus.SERVICE_UNAVAILABLE);
    }
}
