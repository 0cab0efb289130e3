package com.hotride.auth.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(AuthException.class)
    public ResponseEntity<Map<String, Object>> handleAuthException(AuthException e) {
        AuthErrorCode code = e.getErrorCode();
        if (code.getHttpStatus().is5xxServerError()) {
            logger.error("Auth request failed with {}: {}", code, e.getMessage(), e);
        } else {
            logger.debug("Auth request rejected with {}: {}", code, e.getMessage());
        }
        return new ResponseEntity<>(body(code.name(), e.getMessage(), code.isRetryable()), code.getHttpStatus());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        if (message.isEmpty()) {
            message = AuthErrorCode.VALIDATION_FAILED.getDefaultMessage();
        }
        return new ResponseEntity<>(body(AuthErrorCode.VALIDATION_FAILED.name(), message, false), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException e) {
        return new ResponseEntity<>(
                body(AuthErrorCode.VALIDATION_FAILED.name(), "Malformed request body", false),
                HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler({DynamoDbException.class, RepositoryException.class})
    public ResponseEntity<Map<String, Object>> handleDatabaseException(RuntimeException e) {
        logger.error("Database error: {}", e.getMessage(), e);
        return new ResponseEntity<>(body("DATABASE_ERROR", "Please try again later", true),
                HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception e) {
        logger.error("Unexpected error: {}", e.getMessage(), e);
        return new ResponseEntity<>(body("INTERNAL_ERROR", "An unexpected error occurred", false),
                HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private static Map<String, Object> body(String error, String message, boolean retryable) {
        Map<String, Object> errorResponse = new LinkedHashMap<>();
        errorResponse.put("error", error);
        errorResponse.put("message", message);
        errorResponse.put("retryable", retryable);
        return errorResponse;
    }
}
