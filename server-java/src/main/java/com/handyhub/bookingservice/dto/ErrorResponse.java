package com.handyhub.bookingservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.handyhub.bookingservice.exception.BookingException;
import com.handyhub.bookingservice.exception.ErrorCode;
import org.springframework.http.ResponseEntity;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(String error, String code, String message, Map<String, Object> details) {

    public static ResponseEntity<ErrorResponse> toResponseEntity(BookingException e) {
        ErrorCode code = e.getErrorCode();
        return ResponseEntity.status(code.getStatus())
                .body(new ErrorResponse(code.getDefaultMessage(), code.name(), e.getMessage(), e.getDetails()));
    }

    public static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode code, String message, Map<String, Object> details) {
        return ResponseEntity.status(code.getStatus())
                .body(new ErrorResponse(code.getDefaultMessage(), code.name(), message, details));
    }
}
