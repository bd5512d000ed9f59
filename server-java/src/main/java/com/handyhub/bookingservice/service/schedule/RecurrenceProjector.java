package com.handyhub.bookingservice.service.schedule;

import com.handyhub.bookingservice.model.FrequencyUnit;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Expands a start instant and a recurrence rule into the ordered list of occurrence starts.
 *
 * <p>Weekly series keep stepping {@code interval * 7} days from the aligned first occurrence.
 * Monthly series move the previous occurrence forward by {@code interval} calendar months and,
 * when a preferred weekday is set, snap to the first such weekday of the target month;
 * without one the day-of-month is kept and clamped to the month length. Every occurrence
 * carries the time-of-day of the original start.
 */
@Component
public class RecurrenceProjector {

    public List<LocalDateTime> project(LocalDateTime start, RecurrenceRule rule) {
        if (start == null) {
            throw new IllegalArgumentException("start is required");
        }
        LocalTime timeOfDay = start.toLocalTime();
        DayOfWeek preferred = rule.preferredDayOfWeek();

        LocalDateTime current = alignForward(start, preferred);
        List<LocalDateTime> occurrences = new ArrayList<>(rule.count());
        for (int i = 0; i < rule.count(); i++) {
            occurrences.add(current);
            current = next(current, rule, preferred, timeOfDay);
        }
        return Collections.unmodifiableList(occurrences);
    }

    private LocalDateTime next(LocalDateTime previous, RecurrenceRule rule, DayOfWeek preferred, LocalTime timeOfDay) {
        if (rule.unit() == FrequencyUnit.WEEK) {
            return previous.plusDays(7L * rule.interval());
        }
        // plusMonths clamps the day-of-month to the target month's length
        LocalDate moved = previous.toLocalDate().plusMonths(rule.interval());
        if (preferred != null) {
            LocalDate aligned = moved.withDayOfMonth(1);
            while (aligned.getDayOfWeek() != preferred) {
                aligned = aligned.plusDays(1);
            }
            moved = aligned;
        }
        return LocalDateTime.of(moved, timeOfDay);
    }

    private LocalDateTime alignForward(LocalDateTime start, DayOfWeek preferred) {
        LocalDateTime aligned = start;
        if (preferred != null) {
            while (aligned.getDayOfWeek() != preferred) {
                aligned = aligned.plusDays(1);
            }
        }
        return aligned;
    }
}
