package com.wordgraph.lattice.exception;

import com.wordgraph.lattice.dto.ErrorResponse;
import com.wordgraph.lattice.dto.graph.IntegrityReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps lattice exceptions to JSON error responses.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MalformedInputException.class)
    public ResponseEntity<ErrorResponse> handleMalformedInput(MalformedInputException e) {
        log.warn("Rejected lattice input: {} ({} records)", e.getMessage(), e.getRejectedRecords().size());
        return build(HttpStatus.BAD_REQUEST, e.getMessage(), Map.of("rejectedRecords", e.getRejectedRecords()));
    }

    @ExceptionHandler(IntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleIntegrityViolation(IntegrityViolationException e) {
        IntegrityReport report = e.getReport();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("missingWords", report.getMissingWords());
        details.put("unexpectedWords", report.getUnexpectedWords());
        details.put("cycle", report.getCycle());
        return build(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), details);
    }

    @ExceptionHandler(UnreachableNodeReferenceException.class)
    public ResponseEntity<ErrorResponse> handleUnreachableNode(UnreachableNodeReferenceException e) {
        return build(HttpStatus.NOT_FOUND, e.getMessage(), Map.of("nodeId", e.getNodeId()));
    }

    @ExceptionHandler(LatticeNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleLatticeNotFound(LatticeNotFoundException e) {
        return build(HttpStatus.NOT_FOUND, e.getMessage(), null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        Map<String, Object> details = new LinkedHashMap<>();
        for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
            details.putIfAbsent(fieldError.getField(),
                    fieldError.getDefaultMessage() != null ? fieldError.getDefaultMessage() : "invalid");
        }
        return build(HttpStatus.BAD_REQUEST, "Request validation failed", details);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String message, Map<String, Object> details) {
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .details(details)
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
