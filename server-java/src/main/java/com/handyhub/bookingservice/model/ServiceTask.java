package com.handyhub.bookingservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "service_tasks", indexes = {
        @Index(name = "idx_service_task_name", columnList = "task_name", unique = true)
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ServiceTask {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "task_name", nullable = false, unique = true)
    private String taskName;

    @Column(name = "duration_hours", nullable = false)
    private Integer durationHours = 0;

    @Column(name = "duration_minutes", nullable = false)
    private Integer durationMinutes = 0;

    public ServiceTask(String taskName, int durationHours, int durationMinutes) {
        this.taskName = taskName;
        this.durationHours = durationHours;
        this.durationMinutes = durationMinutes;
    }

    public int minutesPerUnit() {
        int hours = durationHours != null ? durationHours : 0;
        int minutes = durationMinutes != null ? durationMinutes : 0;
        return hours * 60 + minutes;
    }
}
