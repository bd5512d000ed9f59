package com.handyhub.bookingservice.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
public abstract class BookingException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BookingException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of(), null);
    }

    protected BookingException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message != null ? message : errorCode.getDefaultMessage(), cause);
        this.errorCode = errorCode;
        this.details = details == null || details.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
