package com.handyhub.bookingservice.service.schedule;

import com.handyhub.bookingservice.model.FrequencyUnit;
import com.handyhub.bookingservice.model.RecurrenceDescriptor;

import java.time.DayOfWeek;

/**
 * Validated recurrence input for {@link RecurrenceProjector}.
 *
 * @param preferredWeekday 0 = Sunday .. 6 = Saturday, or {@code null}
 * @param unit             week or month
 * @param interval         number of units between occurrences, at least 1
 * @param count            number of occurrences, already clamped to [2, 12]
 */
public record RecurrenceRule(Integer preferredWeekday, FrequencyUnit unit, int interval, int count) {

    public RecurrenceRule {
        if (preferredWeekday != null && (preferredWeekday < 0 || preferredWeekday > 6)) {
            throw new IllegalArgumentException("preferredWeekday must be within 0..6: " + preferredWeekday);
        }
        if (unit == null) {
            throw new IllegalArgumentException("frequency unit is required");
        }
        if (interval < 1) {
            throw new IllegalArgumentException("frequency interval must be at least 1: " + interval);
        }
        count = Math.min(Math.max(count, RecurrenceDescriptor.MIN_HORIZON), RecurrenceDescriptor.MAX_HORIZON);
    }

    public static RecurrenceRule from(RecurrenceDescriptor descriptor) {
        if (descriptor == null) {
            throw new IllegalArgumentException("recurrence descriptor is required");
        }
        int interval = descriptor.getFrequencyInterval() != null ? descriptor.getFrequencyInterval() : 0;
        return new RecurrenceRule(descriptor.getPreferredWeekday(), descriptor.getFrequencyUnit(),
                interval, descriptor.effectiveCount());
    }

    public DayOfWeek preferredDayOfWeek() {
        return toDayOfWeek(preferredWeekday);
    }

    public static DayOfWeek toDayOfWeek(Integer weekday) {
        if (weekday == null) {
            return null;
        }
        // java.time counts Monday = 1 .. Sunday = 7
        return weekday == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(weekday);
    }
}
