// =============================================================================
// AidRoute - Routing Exception Handler
// =============================================================================
package com.aidroute.router.error;

import com.aidroute.router.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Maps pipeline and validation failures to {@link ErrorResponse} bodies.
 */
@Slf4j
@RestControllerAdvice
public class RoutingExceptionHandler {

    @ExceptionHandler(RoutingException.class)
    public ResponseEntity<ErrorResponse> handleRoutingException(RoutingException e) {
        RoutingErrorCode code = e.getCode();
        if (code.getHttpStatus() >= 500) {
            log.error("Request failed: code={}, reason={}", code, e.getMessage(), e);
        } else {
            log.warn("Request rejected: code={}, reason={}", code, e.getMessage());
        }
        return respond(code, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(RoutingExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        if (message.isEmpty()) {
            message = RoutingErrorCode.INVALID_REQUEST.getDefaultMessage();
        }
        log.warn("Validation failed: {}", message);
        return respond(RoutingErrorCode.INVALID_REQUEST, message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMostSpecificCause().getMessage());
        return respond(RoutingErrorCode.INVALID_REQUEST, "Malformed request body");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(RoutingErrorCode.INVALID_REQUEST, e.getMessage());
    }

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }

    private static ResponseEntity<ErrorResponse> respond(RoutingErrorCode code, String message) {
        return ResponseEntity.status(code.getHttpStatus())
                .body(new ErrorResponse(code.name(), message, Instant.now()));
    }
}
