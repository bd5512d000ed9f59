package com.handyhub.bookingservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.handyhub.bookingservice.service.RecurringLifecycleService.SeriesEnded;

public record SeriesEndResponse(
        @JsonProperty("series_id") Long seriesId,
        @JsonProperty("ended_count") int endedCount,
        @JsonProperty("engagement") EngagementResponse engagement) {

    public static SeriesEndResponse from(SeriesEnded ended) {
        return new SeriesEndResponse(ended.seriesId(), ended.endedCount(), EngagementResponse.from(ended.engagement()));
    }
}
