package com.handyhub.bookingservice.service;

import com.handyhub.bookingservice.model.TimeBlockStatus;
import com.handyhub.bookingservice.repository.TimeBlockRepository;
import com.handyhub.bookingservice.service.schedule.OccurrenceWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.LocalDateTime;
import java.util.List;

import static com.handyhub.bookingservice.service.BookingFixtures.NOW;
import static com.handyhub.bookingservice.service.BookingFixtures.block;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AvailabilityServiceTest {

    private static final String PROVIDER = "provider-1";
    private static final LocalDateTime DAY = LocalDateTime.of(2025, 6, 10, 0, 0);

    @Mock
    private TimeBlockRepository timeBlockRepository;

    private AvailabilityService availabilityService;

    @BeforeEach
    void setUp() {
        availabilityService = new AvailabilityService(timeBlockRepository);
    }

    @Test
    void bookedBlockInsidePaddingIsAConflict() {
        OccurrenceWindow booked = OccurrenceWindow.forService(DAY.withHour(10), 60);
        OccurrenceWindow requested = OccurrenceWindow.forService(DAY.withHour(11).withMinute(30), 60);
        when(timeBlockRepository.findByProviderIdAndPaddedStartBefore(eq(PROVIDER), any()))
                .thenReturn(List.of(block(PROVIDER, 7L, TimeBlockStatus.BOOKED, booked, null, 0)));

        assertThat(availabilityService.hasConflict(PROVIDER, requested, NOW, null)).isTrue();
        verify(timeBlockRepository).findByProviderIdAndPaddedStartBefore(PROVIDER, requested.paddedEnd());
    }

    @Test
    void expiredHoldIsIgnored() {
        OccurrenceWindow window = OccurrenceWindow.forService(DAY.withHour(10), 60);
        when(timeBlockRepository.findByProviderIdAndPaddedStartBefore(eq(PROVIDER), any()))
                .thenReturn(List.of(block(PROVIDER, 7L, TimeBlockStatus.HELD, window, NOW.minusSeconds(1), 0)));

        assertThat(availabilityService.hasConflict(PROVIDER, window, NOW, null)).isFalse();
    }

    @Test
    void liveHoldBlocksTheSlot() {
        OccurrenceWindow window = OccurrenceWindow.forService(DAY.withHour(10), 60);
        when(timeBlockRepository.findByProviderIdAndPaddedStartBefore(eq(PROVIDER), any()))
                .thenReturn(List.of(block(PROVIDER, 7L, TimeBlockStatus.HELD, window, NOW.plusMinutes(5), 0)));

        assertThat(availabilityService.hasConflict(PROVIDER, window, NOW, null)).isTrue();
    }

    @Test
    void blockEndingBeforePaddedStartIsNotAConflict() {
        // the query only bounds paddedStart, the other side is checked here
        OccurrenceWindow early = OccurrenceWindow.forService(DAY.withHour(6), 60);
        OccurrenceWindow requested = OccurrenceWindow.forService(DAY.withHour(10), 60);
        when(timeBlockRepository.findByProviderIdAndPaddedStartBefore(eq(PROVIDER), any()))
                .thenReturn(List.of(block(PROVIDER, 7L, TimeBlockStatus.BOOKED, early, null, 0)));

        assertThat(availabilityService.hasConflict(PROVIDER, requested, NOW, null)).isFalse();
    }

    @Test
    void ignoredJobDoesNotConflictWithItself() {
        OccurrenceWindow window = OccurrenceWindow.forService(DAY.withHour(10), 60);
        when(timeBlockRepository.findByProviderIdAndPaddedStartBefore(eq(PROVIDER), any()))
                .thenReturn(List.of(block(PROVIDER, 7L, TimeBlockStatus.HELD, window, NOW.minusMinutes(1), 0)));

        assertThat(availabilityService.hasConflict(PROVIDER, window, NOW, 7L)).isFalse();
    }

    @Test
    void reportsFirstFailingOccurrence() {
        OccurrenceWindow first = OccurrenceWindow.forService(DAY.withHour(10), 60);
        OccurrenceWindow second = OccurrenceWindow.forService(DAY.plusDays(7).withHour(10), 60);
        OccurrenceWindow third = OccurrenceWindow.forService(DAY.plusDays(14).withHour(10), 60);
        when(timeBlockRepository.findByProviderIdAndPaddedStartBefore(eq(PROVIDER), any()))
                .thenReturn(List.of(block(PROVIDER, 9L, TimeBlockStatus.BOOKED, second, null, 0)));

        assertThat(availabilityService.firstConflict(PROVIDER, List.of(first, second, third), NOW)).hasValue(1);
        assertThat(availabilityService.isAvailableForAll(PROVIDER, List.of(first, second, third), NOW)).isFalse();
        assertThat(availabilityService.isAvailableForAll(PROVIDER, List.of(third), NOW)).isTrue();
    }
}
