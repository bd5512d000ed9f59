package com.handyhub.bookingservice.service.schedule;

import com.handyhub.bookingservice.exception.InvalidInputException;
import com.handyhub.bookingservice.model.Engagement;
import com.handyhub.bookingservice.service.TaskDurationService;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Turns an engagement into the padded windows a provider has to keep free: one window for a
 * one-off job, one per projected occurrence for a recurring series.
 */
@Component
public class OccurrencePlanner {

    private final RecurrenceProjector recurrenceProjector;
    private final TaskDurationService taskDurationService;

    public OccurrencePlanner(RecurrenceProjector recurrenceProjector, TaskDurationService taskDurationService) {
        this.recurrenceProjector = recurrenceProjector;
        this.taskDurationService = taskDurationService;
    }

    public OccurrencePlan plan(Engagement engagement) {
        if (engagement.getScheduledDate() == null) {
            throw new InvalidInputException("Engagement " + engagement.getId() + " has no scheduled date");
        }
        int durationMinutes = taskDurationService.totalDurationMinutes(engagement.getTasks());
        List<LocalDateTime> starts = occurrenceStarts(engagement);
        List<OccurrenceWindow> windows = starts.stream()
                .map(start -> OccurrenceWindow.forService(start, durationMinutes))
                .toList();
        return new OccurrencePlan(durationMinutes, windows);
    }

    public List<LocalDateTime> occurrenceStarts(Engagement engagement) {
        if (!engagement.isRecurringEngagement()) {
            return List.of(engagement.getScheduledDate());
        }
        RecurrenceRule rule;
        try {
            rule = RecurrenceRule.from(engagement.getRecurrence());
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("Malformed recurrence on engagement " + engagement.getId() + ": " + e.getMessage());
        }
        return recurrenceProjector.project(engagement.seriesStart(), rule);
    }

    public record OccurrencePlan(int totalDurationMinutes, List<OccurrenceWindow> windows) {

        public OccurrenceWindow first() {
            return windows.get(0);
        }
    }
}
