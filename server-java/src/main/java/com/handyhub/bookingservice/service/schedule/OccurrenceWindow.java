package com.handyhub.bookingservice.service.schedule;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One concrete service slot plus the travel/setup padding around it. Availability is always
 * decided on the padded bounds.
 */
public record OccurrenceWindow(LocalDateTime serviceStart,
                               LocalDateTime serviceEnd,
                               LocalDateTime paddedStart,
                               LocalDateTime paddedEnd) {

    public static final int BUFFER_BEFORE_MINUTES = 60;
    public static final int BUFFER_AFTER_MINUTES = 60;

    public OccurrenceWindow {
        Objects.requireNonNull(serviceStart, "serviceStart");
        Objects.requireNonNull(serviceEnd, "serviceEnd");
        Objects.requireNonNull(paddedStart, "paddedStart");
        Objects.requireNonNull(paddedEnd, "paddedEnd");
        if (paddedEnd.isBefore(paddedStart)) {
            throw new IllegalArgumentException("paddedEnd must not precede paddedStart");
        }
    }

    public static OccurrenceWindow forService(LocalDateTime serviceStart, int totalDurationMinutes) {
        if (totalDurationMinutes < 0) {
            throw new IllegalArgumentException("duration must not be negative: " + totalDurationMinutes);
        }
        LocalDateTime serviceEnd = serviceStart.plusMinutes(totalDurationMinutes);
        return new OccurrenceWindow(
                serviceStart,
                serviceEnd,
                serviceStart.minusMinutes(BUFFER_BEFORE_MINUTES),
                serviceEnd.plusMinutes(BUFFER_AFTER_MINUTES));
    }

    /**
     * Half-open overlap on the padded bounds: windows that only touch do not conflict.
     */
    public static boolean overlaps(OccurrenceWindow a, OccurrenceWindow b) {
        return a.paddedStart.isBefore(b.paddedEnd) && a.paddedEnd.isAfter(b.paddedStart);
    }

    public boolean overlaps(OccurrenceWindow other) {
        return overlaps(this, other);
    }
}
