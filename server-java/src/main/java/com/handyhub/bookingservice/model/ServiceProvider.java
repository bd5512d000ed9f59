package com.handyhub.bookingservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;

@Entity
@Table(name = "service_providers")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ServiceProvider {

    @Id
    @Column(name = "provider_id", nullable = false)
    private String providerId;

    @Column(name = "first_name")
    private String firstName;

    @Column(name = "last_name")
    private String lastName;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "provider_categories", joinColumns = @JoinColumn(name = "provider_id"))
    @Column(name = "category", nullable = false)
    private Set<String> categories = new HashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "provider_languages", joinColumns = @JoinColumn(name = "provider_id"))
    @Column(name = "language", nullable = false)
    private Set<String> languages = new HashSet<>();

    @Column(name = "latitude")
    private Double latitude;

    @Column(name = "longitude")
    private Double longitude;

    @Column(nullable = false)
    private Boolean active = Boolean.TRUE;

    // bumped as the first write of every hold transaction for this provider
    @Column(name = "schedule_version", nullable = false)
    private Long scheduleVersion = 0L;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    @PreUpdate
    public void touch() {
        updatedAt = LocalDateTime.now();
        if (scheduleVersion == null) {
            scheduleVersion = 0L;
        }
    }

    public String displayName() {
        String first = firstName != null ? firstName.trim() : "";
        String last = lastName != null ? lastName.trim() : "";
        String name = (first + " " + last).trim();
        return name.isEmpty() ? null : name;
    }
}
