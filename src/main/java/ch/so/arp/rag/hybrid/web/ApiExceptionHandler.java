package ch.so.arp.rag.hybrid.web;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

import jakarta.servlet.http.HttpServletRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import ch.so.arp.rag.hybrid.ConcurrencyConflictException;
import ch.so.arp.rag.hybrid.DanglingReferenceException;
import ch.so.arp.rag.hybrid.InputValidationException;
import ch.so.arp.rag.hybrid.NotFoundException;
import ch.so.arp.rag.hybrid.RetrievalFailedException;

/**
 * Maps the core's exceptions to JSON error responses with a matching status.
 */
@RestControllerAdvice(annotations = RestController.class)
public class ApiExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InputValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(InputValidationException ex,
            HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "invalid_input", ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidArgument(MethodArgumentNotValidException ex,
            HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return respond(HttpStatus.BAD_REQUEST, "invalid_input", message, request);
    }

    @ExceptionHandler({ HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class })
    public ResponseEntity<Map<String, Object>> handleUnreadable(Exception ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "malformed_request", ex.getMessage(), request);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, "not_found", ex.getMessage(), request);
    }

    @ExceptionHandler(DanglingReferenceException.class)
    public ResponseEntity<Map<String, Object>> handleDanglingReference(DanglingReferenceException ex,
            HttpServletRequest request) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "dangling_reference", ex.getMessage(), request);
    }

    @ExceptionHandler(ConcurrencyConflictException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(ConcurrencyConflictException ex,
            HttpServletRequest request) {
        LOGGER.warn("Update of {} kept conflicting and was given up", ex.getKey());
        return respond(HttpStatus.CONFLICT, "conflict", ex.getMessage(), request);
    }

    @ExceptionHandler(RetrievalFailedException.class)
    public ResponseEntity<Map<String, Object>> handleRetrievalFailed(RetrievalFailedException ex,
            HttpServletRequest request) {
        LOGGER.error("Retrieval failed: {}", ex.getMessage(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "retrieval_failed", ex.getMessage(), request);
    }

    private static ResponseEntity<Map<String, Object>> respond(HttpStatus status, String code, String message,
            HttpServletRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", code);
        body.put("message", message);
        if (request != null) {
            body.put("path", request.getRequestURI());
        }
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).body(body);
    }
}
