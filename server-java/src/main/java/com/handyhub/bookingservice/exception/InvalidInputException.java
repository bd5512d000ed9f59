package com.handyhub.bookingservice.exception;

public class InvalidInputException extends BookingException {

    public InvalidInputException(String message) {
        super(ErrorCode.INVALID_INPUT, message);
    }
}
