package com.handyhub.bookingservice.exception;

public class UnauthorizedException extends BookingException {

    public UnauthorizedException(String message) {
        super(ErrorCode.UNAUTHORIZED, message);
    }
}
