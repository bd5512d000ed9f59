package com.handyhub.bookingservice.exception;

public class NotFoundException extends BookingException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
