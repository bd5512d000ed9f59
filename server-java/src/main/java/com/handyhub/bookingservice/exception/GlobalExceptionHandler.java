package com.handyhub.bookingservice.exception;

import com.handyhub.bookingservice.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(BookingException.class)
    public ResponseEntity<ErrorResponse> handleBookingException(BookingException e) {
        if (e.getErrorCode() == ErrorCode.UPSTREAM_FAILURE) {
            logger.error("[GlobalExceptionHandler] Upstream failure: {}", e.getMessage(), e);
        } else {
            logger.warn("[GlobalExceptionHandler] {}: {}", e.getErrorCode(), e.getMessage());
        }
        return ErrorResponse.toResponseEntity(e);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        Map<String, Object> fields = new LinkedHashMap<>();
        e.getBindingResult().getFieldErrors()
                .forEach(error -> fields.putIfAbsent(error.getField(), error.getDefaultMessage()));
        return ErrorResponse.toResponseEntity(ErrorCode.INVALID_INPUT, "Request validation failed", fields);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return ErrorResponse.toResponseEntity(ErrorCode.INVALID_INPUT, "Malformed request body", Map.of());
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(AccessDeniedException e) {
        return ErrorResponse.toResponseEntity(ErrorCode.FORBIDDEN, e.getMessage(), Map.of());
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException e) {
        logger.error("[GlobalExceptionHandler] Document store failure", e);
        return ErrorResponse.toResponseEntity(ErrorCode.UPSTREAM_FAILURE, "Document store unavailable", Map.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        logger.error("[GlobalExceptionHandler] Unexpected failure", e);
        return ErrorResponse.toResponseEntity(ErrorCode.INTERNAL_ERROR, ErrorCode.INTERNAL_ERROR.getDefaultMessage(), Map.of());
    }
}
