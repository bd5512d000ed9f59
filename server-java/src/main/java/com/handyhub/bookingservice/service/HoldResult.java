package com.handyhub.bookingservice.service;

import com.handyhub.bookingservice.service.schedule.OccurrenceWindow;

import java.time.LocalDateTime;
import java.util.List;

public record HoldResult(Long engagementId,
                         String providerId,
                         List<Long> holdIds,
                         LocalDateTime holdExpiresAt,
                         int totalDurationMinutes,
                         List<OccurrenceWindow> windows) {
}
