package com.handyhub.bookingservice.service.schedule;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OccurrenceWindowTest {

    private static final LocalDateTime DAY = LocalDateTime.of(2025, 6, 2, 0, 0);

    @Test
    void forServicePadsBothSidesByAnHour() {
        OccurrenceWindow window = OccurrenceWindow.forService(DAY.withHour(10), 90);

        assertThat(window.serviceEnd()).isEqualTo(DAY.withHour(11).withMinute(30));
        assertThat(window.paddedStart()).isEqualTo(DAY.withHour(9));
        assertThat(window.paddedEnd()).isEqualTo(DAY.withHour(12).withMinute(30));
    }

    @Test
    void paddedOverlapMakesAdjacentJobsConflict() {
        // booked 10:00-11:00, requested 11:30-12:30
        OccurrenceWindow booked = OccurrenceWindow.forService(DAY.withHour(10), 60);
        OccurrenceWindow requested = OccurrenceWindow.forService(DAY.withHour(11).withMinute(30), 60);

        assertThat(booked.paddedStart()).isEqualTo(DAY.withHour(9));
        assertThat(booked.paddedEnd()).isEqualTo(DAY.withHour(12));
        assertThat(requested.paddedStart()).isEqualTo(DAY.withHour(10).withMinute(30));
        assertThat(OccurrenceWindow.overlaps(booked, requested)).isTrue();
    }

    @Test
    void overlapIsSymmetric() {
        OccurrenceWindow a = OccurrenceWindow.forService(DAY.withHour(8), 45);
        OccurrenceWindow b = OccurrenceWindow.forService(DAY.withHour(9), 120);
        OccurrenceWindow c = OccurrenceWindow.forService(DAY.withHour(18), 30);

        assertThat(a.overlaps(b)).isEqualTo(b.overlaps(a)).isTrue();
        assertThat(a.overlaps(c)).isEqualTo(c.overlaps(a)).isFalse();
    }

    @Test
    void touchingPaddedEndpointsDoNotOverlap() {
        // first padded 09:00-12:00, second padded 12:00-15:00
        OccurrenceWindow first = OccurrenceWindow.forService(DAY.withHour(10), 60);
        OccurrenceWindow second = OccurrenceWindow.forService(DAY.withHour(13), 60);

        assertThat(first.paddedEnd()).isEqualTo(second.paddedStart());
        assertThat(OccurrenceWindow.overlaps(first, second)).isFalse();
        assertThat(OccurrenceWindow.overlaps(second, first)).isFalse();
    }

    @Test
    void rejectsNegativeDuration() {
        assertThrows(IllegalArgumentException.class, () -> OccurrenceWindow.forService(DAY, -5));
    }
}
