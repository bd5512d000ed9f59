package com.handyhub.bookingservice.service;

import com.handyhub.bookingservice.exception.InvalidInputException;
import com.handyhub.bookingservice.exception.NotFoundException;
import com.handyhub.bookingservice.model.Engagement;
import com.handyhub.bookingservice.model.ServiceProvider;
import com.handyhub.bookingservice.repository.EngagementRepository;
import com.handyhub.bookingservice.repository.ServiceProviderRepository;
import com.handyhub.bookingservice.security.CallerChecks;
import com.handyhub.bookingservice.security.CallerIdentity;
import com.handyhub.bookingservice.service.schedule.OccurrencePlanner;
import com.handyhub.bookingservice.service.schedule.OccurrencePlanner.OccurrencePlan;
import com.handyhub.bookingservice.service.schedule.OccurrenceWindow;
import com.handyhub.bookingservice.util.BookingTime;
import com.handyhub.bookingservice.util.CategoryNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Lists the providers of the engagement's category who are free for every occurrence.
 * No ranking by distance.
 */
@Service
public class ProviderMatchService {

    private static final Logger logger = LoggerFactory.getLogger(ProviderMatchService.class);

    private final EngagementRepository engagementRepository;
    private final ServiceProviderRepository serviceProviderRepository;
    private final AvailabilityService availabilityService;
    private final OccurrencePlanner occurrencePlanner;
    private final Clock clock;

    public ProviderMatchService(EngagementRepository engagementRepository,
                                ServiceProviderRepository serviceProviderRepository,
                                AvailabilityService availabilityService,
                                OccurrencePlanner occurrencePlanner,
                                Clock clock) {
        this.engagementRepository = engagementRepository;
        this.serviceProviderRepository = serviceProviderRepository;
        this.availabilityService = availabilityService;
        this.occurrencePlanner = occurrencePlanner;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public MatchResult matchProviders(CallerIdentity caller, Long engagementId) {
        CallerChecks.requireCaller(caller);
        Engagement engagement = engagementRepository.findById(engagementId)
                .orElseThrow(() -> new NotFoundException("Engagement not found: " + engagementId));
        CallerChecks.requireOwner(caller, engagement);

        String category = CategoryNormalizer.normalize(engagement.getCategory());
        if (category == null) {
            throw new InvalidInputException("Engagement " + engagementId + " has no category");
        }

        OccurrencePlan plan = occurrencePlanner.plan(engagement);
        LocalDateTime now = BookingTime.now(clock);
        List<ServiceProvider> candidates = serviceProviderRepository.findActiveByCategory(category);
        List<ServiceProvider> available = candidates.stream()
                .filter(provider -> availabilityService.isAvailableForAll(provider.getProviderId(), plan.windows(), now))
                .toList();

        logger.info("[ProviderMatchService] Engagement {} ({}): {} of {} provider(s) free for {} occurrence(s)",
                engagementId, category, available.size(), candidates.size(), plan.windows().size());
        return new MatchResult(engagementId, category, plan.totalDurationMinutes(),
                OccurrenceWindow.BUFFER_BEFORE_MINUTES, OccurrenceWindow.BUFFER_AFTER_MINUTES,
                plan.windows(), available);
    }

    public record MatchResult(Long engagementId,
                              String category,
                              int totalDurationMinutes,
                              int bufferBeforeMinutes,
                              int bufferAfterMinutes,
                              List<OccurrenceWindow> windows,
                              List<ServiceProvider> providers) {
    }
}
