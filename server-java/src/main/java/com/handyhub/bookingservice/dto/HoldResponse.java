package com.handyhub.bookingservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.handyhub.bookingservice.model.EngagementStatus;
import com.handyhub.bookingservice.service.HoldResult;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.IntStream;

public record HoldResponse(
        @JsonProperty("engagement_id") Long engagementId,
        @JsonProperty("provider_id") String providerId,
        @JsonProperty("status") EngagementStatus status,
        @JsonProperty("hold_ids") List<Long> holdIds,
        @JsonProperty("hold_expires_at") LocalDateTime holdExpiresAt,
        @JsonProperty("total_duration_minutes") int totalDurationMinutes,
        @JsonProperty("occurrences") List<OccurrenceWindowDto> occurrences) {

    public static HoldResponse from(HoldResult result) {
        List<OccurrenceWindowDto> occurrences = IntStream.range(0, result.windows().size())
                .mapToObj(i -> OccurrenceWindowDto.of(i, result.windows().get(i)))
                .toList();
        return new HoldResponse(result.engagementId(), result.providerId(), EngagementStatus.REQUESTED,
                result.holdIds(), result.holdExpiresAt(), result.totalDurationMinutes(), occurrences);
    }
}
