package com.handyhub.bookingservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.handyhub.bookingservice.service.ProviderMatchService.MatchResult;

import java.util.List;
import java.util.stream.IntStream;

public record MatchResponse(
        @JsonProperty("engagement_id") Long engagementId,
        @JsonProperty("category") String category,
        @JsonProperty("total_duration_minutes") int totalDurationMinutes,
        @JsonProperty("buffer_before_minutes") int bufferBeforeMinutes,
        @JsonProperty("buffer_after_minutes") int bufferAfterMinutes,
        @JsonProperty("occurrences") List<OccurrenceWindowDto> occurrences,
        @JsonProperty("providers") List<ProviderProfileResponse> providers) {

    public static MatchResponse from(MatchResult result) {
        List<OccurrenceWindowDto> occurrences = IntStream.range(0, result.windows().size())
                .mapToObj(i -> OccurrenceWindowDto.of(i, result.windows().get(i)))
                .toList();
        List<ProviderProfileResponse> providers = result.providers().stream()
                .map(ProviderProfileResponse::from)
                .toList();
        return new MatchResponse(result.engagementId(), result.category(), result.totalDurationMinutes(),
                result.bufferBeforeMinutes(), result.bufferAfterMinutes(), occurrences, providers);
    }
}
