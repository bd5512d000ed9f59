package com.handyhub.bookingservice.service;

import com.handyhub.bookingservice.dto.EngagementCreateRequest;
import com.handyhub.bookingservice.dto.RecurrenceRequest;
import com.handyhub.bookingservice.dto.TaskLineDto;
import com.handyhub.bookingservice.exception.ForbiddenException;
import com.handyhub.bookingservice.exception.InvalidInputException;
import com.handyhub.bookingservice.exception.NotFoundException;
import com.handyhub.bookingservice.model.CallerRole;
import com.handyhub.bookingservice.model.Engagement;
import com.handyhub.bookingservice.model.EngagementStatus;
import com.handyhub.bookingservice.model.EngagementTask;
import com.handyhub.bookingservice.repository.EngagementRepository;
import com.handyhub.bookingservice.security.CallerChecks;
import com.handyhub.bookingservice.security.CallerIdentity;
import com.handyhub.bookingservice.service.schedule.RecurrenceParser;
import com.handyhub.bookingservice.util.BookingTime;
import com.handyhub.bookingservice.util.CategoryNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Service
public class EngagementService {

    private static final Logger logger = LoggerFactory.getLogger(EngagementService.class);

    private final EngagementRepository engagementRepository;
    private final TaskDurationService taskDurationService;
    private final Clock clock;

    public EngagementService(EngagementRepository engagementRepository,
                             TaskDurationService taskDurationService,
                             Clock clock) {
        this.engagementRepository = engagementRepository;
        this.taskDurationService = taskDurationService;
        this.clock = clock;
    }

    @Transactional
    public Engagement create(CallerIdentity caller, EngagementCreateRequest request) {
        CallerChecks.requireRole(caller, CallerRole.CLIENT);

        String category = CategoryNormalizer.normalize(request.getCategory());
        if (category == null) {
            throw new InvalidInputException("category is required");
        }
        if (request.getTasks() == null || request.getTasks().isEmpty()) {
            throw new InvalidInputException("At least one task is required");
        }
        List<EngagementTask> tasks = new ArrayList<>();
        for (TaskLineDto line : request.getTasks()) {
            int quantity = line.getQuantity() == null ? 1 : Math.max(1, line.getQuantity());
            tasks.add(new EngagementTask(line.getLabel() == null ? null : line.getLabel().trim(), quantity));
        }
        // rejects unknown labels before anything is stored
        int durationMinutes = taskDurationService.totalDurationMinutes(tasks);

        LocalDateTime scheduledDate = BookingTime.parse(request.getScheduledDate(), "scheduled_date", clock);
        if (!scheduledDate.isAfter(BookingTime.now(clock))) {
            throw new InvalidInputException("scheduled_date must be in the future");
        }

        Engagement engagement = new Engagement();
        engagement.setClientId(caller.uid());
        engagement.setClientName(request.getClientName());
        engagement.setCategory(category);
        engagement.setLocationText(request.getLocationText());
        engagement.setLatitude(request.getLatitude());
        engagement.setLongitude(request.getLongitude());
        engagement.setTasks(tasks);
        engagement.setScheduledDate(scheduledDate);
        engagement.setStatus(EngagementStatus.OPEN);

        boolean recurring = Boolean.TRUE.equals(request.getRecurring());
        engagement.setRecurring(recurring);
        if (recurring) {
            RecurrenceRequest recurrence = request.getRecurrence();
            if (recurrence == null) {
                throw new InvalidInputException("recurrence is required for a recurring engagement");
            }
            engagement.setRecurrence(RecurrenceParser.parse(recurrence.getPreferredWeekday(),
                    recurrence.getFrequencyUnit(), recurrence.getFrequencyInterval(), recurrence.getHorizonCount()));
        }

        Engagement saved = engagementRepository.save(engagement);
        logger.info("[EngagementService] Client {} created engagement {} ({}, {} min, recurring={})",
                caller.uid(), saved.getId(), category, durationMinutes, recurring);
        return saved;
    }

    @Transactional(readOnly = true)
    public Engagement get(CallerIdentity caller, Long engagementId) {
        CallerChecks.requireCaller(caller);
        Engagement engagement = engagementRepository.findById(engagementId)
                .orElseThrow(() -> new NotFoundException("Engagement not found: " + engagementId));
        if (!CallerChecks.canRead(caller, engagement)) {
            throw new ForbiddenException("Engagement " + engagementId + " is not visible to you");
        }
        return engagement;
    }

    @Transactional(readOnly = true)
    public List<Engagement> listForCaller(CallerIdentity caller) {
        CallerChecks.requireCaller(caller);
        if (caller.hasRole(CallerRole.ADMIN)) {
            return engagementRepository.findAll();
        }
        if (caller.hasRole(CallerRole.PROVIDER)) {
            return engagementRepository.findBySelectedProviderIdOrderByScheduledDateAsc(caller.uid());
        }
        return engagementRepository.findByClientIdOrderByScheduledDateAsc(caller.uid());
    }

    @Transactional(readOnly = true)
    public List<Engagement> listSeries(CallerIdentity caller, Long engagementId) {
        Engagement engagement = get(caller, engagementId);
        if (!engagement.isRecurringEngagement()) {
            return List.of(engagement);
        }
        List<Engagement> members = new ArrayList<>(engagementRepository.findByRecurrenceSeriesId(engagement.effectiveSeriesId()));
        if (members.stream().noneMatch(member -> member.getId().equals(engagement.effectiveSeriesId()))) {
            engagementRepository.findById(engagement.effectiveSeriesId()).ifPresent(root -> members.add(0, root));
        }
        members.sort((a, b) -> Integer.compare(
                a.getRecurrenceIndex() == null ? 0 : a.getRecurrenceIndex(),
                b.getRecurrenceIndex() == null ? 0 : b.getRecurrenceIndex()));
        return members;
    }
}
