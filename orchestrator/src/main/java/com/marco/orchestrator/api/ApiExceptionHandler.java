package com.marco.orchestrator.api;

import com.marco.orchestrator.workflow.IllegalCommandStateException;
import com.marco.orchestrator.workflow.UnknownCommandException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps orchestrator exceptions onto HTTP status codes:
 * unknown command 404, wrong phase 409, bad input 400.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(UnknownCommandException.class)
    public ResponseEntity<Map<String, Object>> unknownCommand(UnknownCommandException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage(), null);
    }

    @ExceptionHandler(IllegalCommandStateException.class)
    public ResponseEntity<Map<String, Object>> wrongPhase(IllegalCommandStateException e) {
        return error(HttpStatus.CONFLICT, e.getMessage(), e.getPhase().name());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage(), null);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message, String phase) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error",  message);
        if (phase != null) body.put("phase", phase);
        return ResponseEntity.status(status).body(body);
    }
}
