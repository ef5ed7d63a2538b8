package com.agentgraph.api;

import com.agentgraph.graph.GraphException;
import com.agentgraph.protocol.ProtocolEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Errors raised before a run starts are answered with a single {@code RUN_ERROR}
 * event as the JSON body.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    static final String INVALID_REQUEST = "INVALID_REQUEST";

    @ExceptionHandler(GraphException.class)
    public ResponseEntity<ProtocolEvent> handleGraphException(GraphException ex) {
        log.warn("Rejected graph: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ProtocolEvent.runError(ex.getMessage(), GraphException.CODE));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProtocolEvent> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .distinct()
                .collect(Collectors.joining(", ", "Invalid request fields: ", ""));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ProtocolEvent.runError(message, INVALID_REQUEST));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProtocolEvent> handleUnreadable(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ProtocolEvent.runError("Malformed request body", INVALID_REQUEST));
    }
}
