package com.handyhub.bookingservice.exception;

import java.util.Map;

public class UpstreamFailureException extends BookingException {

    public UpstreamFailureException(String message, Throwable cause) {
        super(ErrorCode.UPSTREAM_FAILURE, message, Map.of(), cause);
    }
}
