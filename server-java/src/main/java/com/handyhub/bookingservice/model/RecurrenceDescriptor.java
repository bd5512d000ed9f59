package com.handyhub.bookingservice.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecurrenceDescriptor {

    public static final int DEFAULT_HORIZON = 6;
    public static final int MIN_HORIZON = 2;
    public static final int MAX_HORIZON = 12;

    @Column(name = "preferred_weekday")
    private Integer preferredWeekday; // 0 = Sunday .. 6 = Saturday

    @Enumerated(EnumType.STRING)
    @Column(name = "frequency_unit")
    private FrequencyUnit frequencyUnit;

    @Column(name = "frequency_interval")
    private Integer frequencyInterval;

    @Column(name = "horizon_count")
    private Integer horizonCount;

    // anchor of the series: the weekday-aligned first occurrence, fixed when the provider is held
    @Column(name = "series_start_at")
    private LocalDateTime startAt;

    @Column(name = "ended_by")
    private String endedBy; // client, provider

    @Column(name = "ended_at")
    private LocalDateTime endedAt;

    public RecurrenceDescriptor(Integer preferredWeekday, FrequencyUnit frequencyUnit,
                                Integer frequencyInterval, Integer horizonCount) {
        this.preferredWeekday = preferredWeekday;
        this.frequencyUnit = frequencyUnit;
        this.frequencyInterval = frequencyInterval;
        this.horizonCount = horizonCount;
    }

    public int effectiveCount() {
        if (horizonCount == null) {
            return DEFAULT_HORIZON;
        }
        return Math.min(Math.max(horizonCount, MIN_HORIZON), MAX_HORIZON);
    }

    public RecurrenceDescriptor copy() {
        return new RecurrenceDescriptor(preferredWeekday, frequencyUnit, frequencyInterval,
                horizonCount, startAt, endedBy, endedAt);
    }
}
