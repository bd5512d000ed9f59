package com.handyhub.bookingservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class HoldRequest {
    @NotBlank
    @JsonProperty("provider_id")
    private String providerId;
}
