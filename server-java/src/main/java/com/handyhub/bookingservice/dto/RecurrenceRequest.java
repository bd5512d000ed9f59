package com.handyhub.bookingservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class RecurrenceRequest {
    // weekday name ("tuesday", "tue") or 0-6 with 0 = Sunday
    @JsonProperty("preferred_weekday")
    private String preferredWeekday;

    @NotBlank
    @JsonProperty("frequency_unit")
    private String frequencyUnit;

    @NotNull
    @JsonProperty("frequency_interval")
    private Integer frequencyInterval;

    @JsonProperty("horizon_count")
    private Integer horizonCount;
}
