package com.handyhub.bookingservice.util;

import com.handyhub.bookingservice.exception.InvalidInputException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

public final class BookingTime {

    private BookingTime() {
    }

    /**
     * Current wall-clock time at the precision the store keeps (whole seconds).
     */
    public static LocalDateTime now(Clock clock) {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
    }

    /**
     * Parses an ISO-8601 instant from a request. A value with an offset is converted to the
     * service zone; a local value is taken as already being in it.
     */
    public static LocalDateTime parse(String raw, String fieldName, Clock clock) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidInputException(fieldName + " is required");
        }
        String value = raw.trim();
        try {
            return OffsetDateTime.parse(value)
                    .atZoneSameInstant(clock.getZone())
                    .toLocalDateTime()
                    .truncatedTo(ChronoUnit.SECONDS);
        } catch (DateTimeParseException offsetMissing) {
            try {
                return LocalDateTime.parse(value).truncatedTo(ChronoUnit.SECONDS);
            } catch (DateTimeParseException e) {
                throw new InvalidInputException(fieldName + " must be an ISO-8601 date-time: " + raw);
            }
        }
    }
}
