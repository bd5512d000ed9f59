package com.handyhub.bookingservice.service.schedule;

import com.handyhub.bookingservice.exception.InvalidInputException;
import com.handyhub.bookingservice.model.FrequencyUnit;
import com.handyhub.bookingservice.model.RecurrenceDescriptor;

import java.util.Locale;
import java.util.Map;

/**
 * Reads the client's recurrence fields. Bad values are rejected rather than defaulted.
 */
public final class RecurrenceParser {

    private static final Map<String, Integer> WEEKDAYS = Map.ofEntries(
            Map.entry("sunday", 0), Map.entry("sun", 0),
            Map.entry("monday", 1), Map.entry("mon", 1),
            Map.entry("tuesday", 2), Map.entry("tue", 2),
            Map.entry("wednesday", 3), Map.entry("wed", 3),
            Map.entry("thursday", 4), Map.entry("thu", 4),
            Map.entry("friday", 5), Map.entry("fri", 5),
            Map.entry("saturday", 6), Map.entry("sat", 6));

    private RecurrenceParser() {
    }

    /**
     * @return 0 (Sunday) .. 6 (Saturday), or {@code null} when no weekday was given
     */
    public static Integer parseWeekday(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        Integer named = WEEKDAYS.get(value);
        if (named != null) {
            return named;
        }
        if (value.matches("[0-6]")) {
            return Integer.parseInt(value);
        }
        throw new InvalidInputException("preferred_weekday must be a weekday name or 0-6 (0 = Sunday): " + raw);
    }

    public static RecurrenceDescriptor parse(String preferredWeekday, String frequencyUnit,
                                             Integer frequencyInterval, Integer horizonCount) {
        FrequencyUnit unit = FrequencyUnit.parse(frequencyUnit);
        if (unit == null) {
            throw new InvalidInputException("frequency_unit must be 'week' or 'month': " + frequencyUnit);
        }
        if (frequencyInterval == null || frequencyInterval < 1) {
            throw new InvalidInputException("frequency_interval must be at least 1");
        }
        Integer horizon = horizonCount == null
                ? null
                : Math.min(Math.max(horizonCount, RecurrenceDescriptor.MIN_HORIZON), RecurrenceDescriptor.MAX_HORIZON);
        return new RecurrenceDescriptor(parseWeekday(preferredWeekday), unit, frequencyInterval, horizon);
    }
}
