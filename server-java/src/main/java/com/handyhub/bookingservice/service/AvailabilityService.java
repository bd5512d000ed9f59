package com.handyhub.bookingservice.service;

import com.handyhub.bookingservice.model.TimeBlock;
import com.handyhub.bookingservice.model.TimeBlockStatus;
import com.handyhub.bookingservice.repository.TimeBlockRepository;
import com.handyhub.bookingservice.service.schedule.OccurrenceWindow;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Decides whether a provider's existing reservations leave a padded window free.
 *
 * <p>Only {@code held} and {@code booked} blocks count, and a hold whose expiry has passed is
 * ignored even if nobody has cleaned it up yet.
 */
@Service
public class AvailabilityService {

    private final TimeBlockRepository timeBlockRepository;

    public AvailabilityService(TimeBlockRepository timeBlockRepository) {
        this.timeBlockRepository = timeBlockRepository;
    }

    /**
     * @param ignoreJobId blocks of this job are not counted, or {@code null} to count all
     */
    public boolean hasConflict(String providerId, OccurrenceWindow window, LocalDateTime now, Long ignoreJobId) {
        List<TimeBlock> candidates = timeBlockRepository.findByProviderIdAndPaddedStartBefore(providerId, window.paddedEnd());
        for (TimeBlock block : candidates) {
            if (ignoreJobId != null && Objects.equals(ignoreJobId, block.getJobId())) {
                continue;
            }
            if (block.getStatus() != TimeBlockStatus.HELD && block.getStatus() != TimeBlockStatus.BOOKED) {
                continue;
            }
            if (!block.isActiveAt(now)) {
                continue;
            }
            if (block.window().overlaps(window)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Index of the first window the provider cannot take, or empty if all are free.
     */
    public OptionalInt firstConflict(String providerId, List<OccurrenceWindow> windows, LocalDateTime now) {
        return firstConflict(providerId, windows, now, null);
    }

    public OptionalInt firstConflict(String providerId, List<OccurrenceWindow> windows, LocalDateTime now, Long ignoreJobId) {
        for (int i = 0; i < windows.size(); i++) {
            if (hasConflict(providerId, windows.get(i), now, ignoreJobId)) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    public boolean isAvailableForAll(String providerId, List<OccurrenceWindow> windows, LocalDateTime now) {
        return firstConflict(providerId, windows, now).isEmpty();
    }
}
