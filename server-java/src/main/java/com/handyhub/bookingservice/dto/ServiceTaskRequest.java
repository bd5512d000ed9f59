package com.handyhub.bookingservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ServiceTaskRequest {
    @NotBlank
    @JsonProperty("task_name")
    private String taskName;

    @NotNull
    @Min(0)
    @JsonProperty("duration_hours")
    private Integer durationHours;

    @NotNull
    @Min(0)
    @JsonProperty("duration_minutes")
    private Integer durationMinutes;
}
