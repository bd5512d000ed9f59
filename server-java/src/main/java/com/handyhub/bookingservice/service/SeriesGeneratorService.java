package com.handyhub.bookingservice.service;

import com.handyhub.bookingservice.dto.BatchFailure;
import com.handyhub.bookingservice.dto.SeriesGenerationSummary;
import com.handyhub.bookingservice.exception.NotFoundException;
import com.handyhub.bookingservice.model.Engagement;
import com.handyhub.bookingservice.model.EngagementStatus;
import com.handyhub.bookingservice.model.EngagementTask;
import com.handyhub.bookingservice.model.RecurrenceDescriptor;
import com.handyhub.bookingservice.repository.EngagementRepository;
import com.handyhub.bookingservice.service.schedule.OccurrencePlanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Materializes the future occurrences of every accepted recurring engagement as
 * {@code scheduled} engagements. Safe to run repeatedly and concurrently: an occurrence index
 * that already exists in the series is never created twice.
 */
@Service
public class SeriesGeneratorService {

    private static final Logger logger = LoggerFactory.getLogger(SeriesGeneratorService.class);

    private final EngagementRepository engagementRepository;
    private final OccurrencePlanner occurrencePlanner;
    private final TransactionRunner transactionRunner;

    public SeriesGeneratorService(EngagementRepository engagementRepository,
                                  OccurrencePlanner occurrencePlanner,
                                  TransactionRunner transactionRunner) {
        this.engagementRepository = engagementRepository;
        this.occurrencePlanner = occurrencePlanner;
        this.transactionRunner = transactionRunner;
    }

    public SeriesGenerationSummary generate() {
        List<Engagement> roots = engagementRepository.findByRecurringTrue().stream()
                .filter(Engagement::isSeriesRoot)
                .filter(engagement -> engagement.getStatus() == EngagementStatus.ACCEPTED)
                .toList();

        int generated = 0;
        Map<Long, Integer> createdBySeries = new LinkedHashMap<>();
        List<BatchFailure> failures = new ArrayList<>();
        for (Engagement root : roots) {
            try {
                int created = generateForRoot(root.getId());
                if (created > 0) {
                    createdBySeries.put(root.effectiveSeriesId(), created);
                    generated += created;
                }
            } catch (RuntimeException e) {
                logger.error("[SeriesGeneratorService] Series of engagement {} failed", root.getId(), e);
                failures.add(new BatchFailure(root.getId(), e.getMessage()));
            }
        }

        logger.info("[SeriesGeneratorService] Scanned {} root(s), generated {} occurrence(s), {} failure(s)",
                roots.size(), generated, failures.size());
        return new SeriesGenerationSummary(roots.size(), generated, createdBySeries, failures);
    }

    /**
     * @return number of occurrences created for this root
     */
    int generateForRoot(Long rootId) {
        Engagement root = transactionRunner.execute("backfill series " + rootId, status -> {
            Engagement current = engagementRepository.findById(rootId)
                    .orElseThrow(() -> new NotFoundException("Engagement not found: " + rootId));
            boolean changed = false;
            if (current.getRecurrenceSeriesId() == null) {
                current.setRecurrenceSeriesId(current.getId());
                changed = true;
            }
            if (current.getRecurrenceIndex() == null) {
                current.setRecurrenceIndex(0);
                changed = true;
            }
            return changed ? engagementRepository.save(current) : current;
        });

        Long seriesId = root.getRecurrenceSeriesId();
        List<LocalDateTime> occurrences = occurrencePlanner.occurrenceStarts(root);
        Set<Integer> existing = engagementRepository.findByRecurrenceSeriesId(seriesId).stream()
                .map(Engagement::getRecurrenceIndex)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());

        int created = 0;
        for (int index = 1; index < occurrences.size(); index++) {
            if (existing.contains(index)) {
                continue;
            }
            int occurrenceIndex = index;
            LocalDateTime scheduledDate = occurrences.get(index);
            try {
                transactionRunner.execute("create occurrence " + index + " of series " + seriesId,
                        status -> engagementRepository.save(occurrenceOf(root, occurrenceIndex, scheduledDate)));
                created++;
            } catch (DataIntegrityViolationException e) {
                // another run created this index first
                logger.info("[SeriesGeneratorService] Occurrence {} of series {} already present", index, seriesId);
            }
        }
        if (created > 0) {
            logger.info("[SeriesGeneratorService] Series {}: created {} occurrence(s)", seriesId, created);
        }
        return created;
    }

    private static Engagement occurrenceOf(Engagement root, int index, LocalDateTime scheduledDate) {
        Engagement occurrence = new Engagement();
        occurrence.setClientId(root.getClientId());
        occurrence.setClientName(root.getClientName());
        occurrence.setCategory(root.getCategory());
        occurrence.setLocationText(root.getLocationText());
        occurrence.setLatitude(root.getLatitude());
        occurrence.setLongitude(root.getLongitude());
        List<EngagementTask> tasks = new ArrayList<>();
        for (EngagementTask task : root.getTasks()) {
            tasks.add(new EngagementTask(task.getLabel(), task.getQuantity()));
        }
        occurrence.setTasks(tasks);
        occurrence.setRecurring(true);
        if (root.getRecurrence() != null) {
            RecurrenceDescriptor recurrence = root.getRecurrence().copy();
            if (recurrence.getStartAt() == null) {
                recurrence.setStartAt(root.seriesStart());
            }
            occurrence.setRecurrence(recurrence);
        }
        occurrence.setRecurrenceSeriesId(root.getRecurrenceSeriesId());
        occurrence.setRecurrenceIndex(index);
        occurrence.setScheduledDate(scheduledDate);
        occurrence.setStatus(EngagementStatus.SCHEDULED);
        occurrence.setSelectedProviderId(root.getSelectedProviderId());
        occurrence.setProviderName(root.getProviderName());
        occurrence.setProviderResponseAt(root.getProviderResponseAt());
        occurrence.setReminderSent(false);
        return occurrence;
    }
}
