package com.withdrawalaudit.api.controller;

import com.withdrawalaudit.api.dto.ErrorBody;
import com.withdrawalaudit.api.validation.DurationInputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Optional;

/**
 * Maps validation failures (@Valid) and unreadable bodies to 400 with ErrorBody (error, message, timestamp).
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class ValidationExceptionHandler {

    private final DurationInputValidator durationInputValidator;

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        Optional<FieldError> fieldError = Optional.ofNullable(ex.getFieldError());
        String error = fieldError
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        String message = userFacingMessage(error, fieldError.orElse(null), ex);
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleUnreadable(ServerWebInputException ex) {
        log.debug("Rejected unreadable request body: {}", ex.getReason());
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", "Malformed request body"));
    }

    private String userFacingMessage(String errorCode, FieldError fieldError, WebExchangeBindException ex) {
        return switch (errorCode) {
            case "INVALID_DURATION" -> durationInputValidator.validate(
                    fieldError != null ? fieldError.getRejectedValue() : null);
            case "INVALID_REQUEST" -> "measurement is required";
            default -> ex.getFieldErrors().stream()
                    .findFirst()
                    .map(e -> e.getField() + ": " + e.getDefaultMessage())
                    .orElse("Validation failed");
        };
    }
}
