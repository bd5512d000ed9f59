package com.handyhub.bookingservice.exception;

public class ForbiddenException extends BookingException {

    public ForbiddenException(String message) {
        super(ErrorCode.FORBIDDEN, message);
    }
}
