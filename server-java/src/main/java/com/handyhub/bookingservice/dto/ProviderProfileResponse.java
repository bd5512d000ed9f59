package com.handyhub.bookingservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.handyhub.bookingservice.model.ServiceProvider;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

@Data
public class ProviderProfileResponse {
    @JsonProperty("provider_id")
    private String providerId;

    @JsonProperty("first_name")
    private String firstName;

    @JsonProperty("last_name")
    private String lastName;

    @JsonProperty("display_name")
    private String displayName;

    private List<String> categories;
    private List<String> languages;
    private Double latitude;
    private Double longitude;
    private boolean active;

    @JsonProperty("updated_at")
    private LocalDateTime updatedAt;

    public static ProviderProfileResponse from(ServiceProvider provider) {
        ProviderProfileResponse response = new ProviderProfileResponse();
        response.setProviderId(provider.getProviderId());
        response.setFirstName(provider.getFirstName());
        response.setLastName(provider.getLastName());
        response.setDisplayName(provider.displayName());
        response.setCategories(provider.getCategories().stream().sorted().toList());
        response.setLanguages(provider.getLanguages().stream().sorted().toList());
        response.setLatitude(provider.getLatitude());
        response.setLongitude(provider.getLongitude());
        response.setActive(Boolean.TRUE.equals(provider.getActive()));
        response.setUpdatedAt(provider.getUpdatedAt());
        return response;
    }
}
