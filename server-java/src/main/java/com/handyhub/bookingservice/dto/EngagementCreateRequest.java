package com.handyhub.bookingservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;

@Data
public class EngagementCreateRequest {
    @NotBlank
    private String category;

    @JsonProperty("client_name")
    private String clientName;

    @JsonProperty("location_text")
    private String locationText;

    @NotNull
    private Double latitude;

    @NotNull
    private Double longitude;

    @NotEmpty
    @Valid
    private List<TaskLineDto> tasks;

    @NotBlank
    @JsonProperty("scheduled_date")
    private String scheduledDate;

    private Boolean recurring = false;

    @Valid
    private RecurrenceRequest recurrence;
}
