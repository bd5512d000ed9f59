package com.handyhub.bookingservice.service.schedule;

import com.handyhub.bookingservice.model.FrequencyUnit;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RecurrenceProjectorTest {

    private static final int SUNDAY = 0;
    private static final int WEDNESDAY = 3;
    private static final int TUESDAY = 2;

    private final RecurrenceProjector projector = new RecurrenceProjector();

    @Test
    void weeklySeriesAlignsForwardToPreferredWeekday() {
        LocalDateTime monday = LocalDateTime.of(2025, 6, 2, 9, 0);

        List<LocalDateTime> occurrences = projector.project(monday,
                new RecurrenceRule(WEDNESDAY, FrequencyUnit.WEEK, 1, 3));

        assertThat(occurrences).containsExactly(
                LocalDateTime.of(2025, 6, 4, 9, 0),
                LocalDateTime.of(2025, 6, 11, 9, 0),
                LocalDateTime.of(2025, 6, 18, 9, 0));
    }

    @Test
    void startAlreadyOnPreferredWeekdayIsKept() {
        LocalDateTime wednesday = LocalDateTime.of(2025, 6, 4, 14, 30);

        List<LocalDateTime> occurrences = projector.project(wednesday,
                new RecurrenceRule(WEDNESDAY, FrequencyUnit.WEEK, 2, 2));

        assertThat(occurrences).containsExactly(wednesday, wednesday.plusDays(14));
    }

    @Test
    void monthlySeriesClampsToShortMonth() {
        LocalDateTime january31 = LocalDateTime.of(2025, 1, 31, 9, 0);

        List<LocalDateTime> occurrences = projector.project(january31,
                new RecurrenceRule(null, FrequencyUnit.MONTH, 1, 3));

        assertThat(occurrences.get(0)).isEqualTo(january31);
        assertThat(occurrences.get(1)).isEqualTo(LocalDateTime.of(2025, 2, 28, 9, 0));
        assertThat(occurrences.get(1).getMonthValue()).isEqualTo(2);
    }

    @Test
    void monthlySeriesClampsToLeapDay() {
        List<LocalDateTime> occurrences = projector.project(LocalDateTime.of(2024, 1, 31, 9, 0),
                new RecurrenceRule(null, FrequencyUnit.MONTH, 1, 2));

        assertThat(occurrences.get(1)).isEqualTo(LocalDateTime.of(2024, 2, 29, 9, 0));
    }

    @Test
    void monthlySeriesWithWeekdayUsesFirstMatchingDayOfTargetMonth() {
        LocalDateTime start = LocalDateTime.of(2025, 6, 10, 8, 15);

        List<LocalDateTime> occurrences = projector.project(start,
                new RecurrenceRule(TUESDAY, FrequencyUnit.MONTH, 1, 3));

        assertThat(occurrences).containsExactly(
                LocalDateTime.of(2025, 6, 10, 8, 15),
                LocalDateTime.of(2025, 7, 1, 8, 15),
                LocalDateTime.of(2025, 8, 5, 8, 15));
        assertThat(occurrences).allMatch(o -> o.getDayOfWeek() == DayOfWeek.TUESDAY);
    }

    @Test
    void emitsExactlyCountStrictlyIncreasingOccurrences() {
        LocalDateTime start = LocalDateTime.of(2025, 3, 29, 23, 0);

        for (FrequencyUnit unit : FrequencyUnit.values()) {
            List<LocalDateTime> occurrences = projector.project(start, new RecurrenceRule(SUNDAY, unit, 1, 12));

            assertThat(occurrences).hasSize(12);
            for (int i = 1; i < occurrences.size(); i++) {
                assertThat(occurrences.get(i)).isAfter(occurrences.get(i - 1));
            }
            assertThat(occurrences.get(0)).isEqualTo(LocalDateTime.of(2025, 3, 30, 23, 0));
        }
    }

    @Test
    void countIsClampedToSupportedHorizon() {
        LocalDateTime start = LocalDateTime.of(2025, 6, 2, 9, 0);

        assertThat(projector.project(start, new RecurrenceRule(null, FrequencyUnit.WEEK, 1, 1))).hasSize(2);
        assertThat(projector.project(start, new RecurrenceRule(null, FrequencyUnit.WEEK, 1, 40))).hasSize(12);
    }

    @Test
    void ruleRejectsInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> new RecurrenceRule(7, FrequencyUnit.WEEK, 1, 3));
        assertThrows(IllegalArgumentException.class, () -> new RecurrenceRule(null, null, 1, 3));
        assertThrows(IllegalArgumentException.class, () -> new RecurrenceRule(null, FrequencyUnit.MONTH, 0, 3));
    }
}
