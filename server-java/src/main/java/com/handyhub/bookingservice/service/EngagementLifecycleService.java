package com.handyhub.bookingservice.service;

import com.handyhub.bookingservice.exception.InvalidInputException;
import com.handyhub.bookingservice.exception.NotFoundException;
import com.handyhub.bookingservice.model.CallerRole;
import com.handyhub.bookingservice.model.Engagement;
import com.handyhub.bookingservice.model.EngagementStatus;
import com.handyhub.bookingservice.model.ProviderDecision;
import com.handyhub.bookingservice.repository.EngagementRepository;
import com.handyhub.bookingservice.repository.ServiceProviderRepository;
import com.handyhub.bookingservice.security.CallerChecks;
import com.handyhub.bookingservice.security.CallerIdentity;
import com.handyhub.bookingservice.util.BookingTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.function.Consumer;

/**
 * Status transitions of a single engagement after a provider has been held.
 *
 * <p>The status change commits first. Releasing time blocks and notifying the other party
 * happen afterwards and never undo the change when they fail.
 */
@Service
public class EngagementLifecycleService {

    private static final Logger logger = LoggerFactory.getLogger(EngagementLifecycleService.class);

    private final EngagementRepository engagementRepository;
    private final ServiceProviderRepository serviceProviderRepository;
    private final HoldService holdService;
    private final NotificationService notificationService;
    private final TransactionRunner transactionRunner;
    private final Clock clock;

    public EngagementLifecycleService(EngagementRepository engagementRepository,
                                      ServiceProviderRepository serviceProviderRepository,
                                      HoldService holdService,
                                      NotificationService notificationService,
                                      TransactionRunner transactionRunner,
                                      Clock clock) {
        this.engagementRepository = engagementRepository;
        this.serviceProviderRepository = serviceProviderRepository;
        this.holdService = holdService;
        this.notificationService = notificationService;
        this.transactionRunner = transactionRunner;
        this.clock = clock;
    }

    /**
     * The assigned provider accepts (held blocks become booked) or declines (blocks deleted,
     * provider cleared) a requested engagement.
     */
    public Engagement respond(CallerIdentity caller, Long engagementId, ProviderDecision decision) {
        CallerChecks.requireRole(caller, CallerRole.PROVIDER);
        if (decision == null) {
            throw new InvalidInputException("decision must be 'accepted' or 'declined'");
        }
        String providerId = caller.uid();

        Engagement engagement = transactionRunner.execute("respond to engagement " + engagementId, status -> {
            // same lock order as a hold: provider row first
            serviceProviderRepository.bumpScheduleVersion(providerId);
            Engagement current = load(engagementId);
            CallerChecks.requireAssignee(caller, current);
            TransitionGuard.requireStatus(current, "respond", EngagementStatus.REQUESTED);

            holdService.resolveHolds(providerId, current.getId(), decision);
            LocalDateTime now = BookingTime.now(clock);
            current.setProviderResponseAt(now);
            current.setHoldExpiresAt(null);
            if (decision == ProviderDecision.ACCEPTED) {
                current.setStatus(EngagementStatus.ACCEPTED);
            } else {
                current.setStatus(EngagementStatus.DECLINED);
                current.clearProviderSelection();
            }
            return engagementRepository.save(current);
        });

        logger.info("[EngagementLifecycleService] Provider {} {} engagement {}", providerId, decision.wireValue(), engagementId);
        if (decision == ProviderDecision.ACCEPTED) {
            notificationService.notifyUser(engagement.getClientId(), "Job Accepted",
                    "Your provider accepted the job.", "job_accepted", engagementId, "/jobs/" + engagementId);
        } else {
            notificationService.notifyUser(engagement.getClientId(), "Job Declined",
                    "Your provider declined the job. Please select another provider.", "job_declined",
                    engagementId, "/jobs/" + engagementId);
        }
        return engagement;
    }

    public Engagement createQuotation(CallerIdentity caller, Long engagementId) {
        Engagement engagement = change("create quotation", engagementId, current -> {
            CallerChecks.requireAssignee(caller, current);
            TransitionGuard.requireStatus(current, "create quotation", EngagementStatus.ACCEPTED);
            current.setStatus(EngagementStatus.QUOTATION_CREATED);
            current.setQuotationCreatedAt(BookingTime.now(clock));
        });
        notificationService.notifyUser(engagement.getClientId(), "Quotation Ready",
                "Your provider sent a quotation.", "quotation_created", engagementId, "/jobs/" + engagementId);
        return engagement;
    }

    public Engagement decideQuotation(CallerIdentity caller, Long engagementId, ProviderDecision decision) {
        if (decision == null) {
            throw new InvalidInputException("decision must be 'accepted' or 'declined'");
        }
        Engagement engagement = change("decide quotation", engagementId, current -> {
            CallerChecks.requireOwner(caller, current);
            TransitionGuard.requireStatus(current, "decide quotation", EngagementStatus.QUOTATION_CREATED);
            current.setStatus(decision == ProviderDecision.ACCEPTED
                    ? EngagementStatus.QUOTATION_ACCEPTED
                    : EngagementStatus.QUOTATION_DECLINED_PENDING_VISITATION);
            current.setQuotationDecisionAt(BookingTime.now(clock));
        });
        notificationService.notifyUser(engagement.getSelectedProviderId(), "Quotation " + capitalize(decision.wireValue()),
                "The client " + decision.wireValue() + " your quotation.", "quotation_" + decision.wireValue(),
                engagementId, "/provider/jobs/" + engagementId);
        return engagement;
    }

    /**
     * Ends a job whose quotation was declined once the provider has collected the visit fee.
     */
    public Engagement confirmVisitationFee(CallerIdentity caller, Long engagementId) {
        Engagement engagement = change("confirm visitation fee", engagementId, current -> {
            CallerChecks.requireAssignee(caller, current);
            TransitionGuard.requireStatus(current, "confirm visitation fee",
                    EngagementStatus.QUOTATION_DECLINED_PENDING_VISITATION);
            current.setStatus(EngagementStatus.TERMINATED_AFTER_QUOTATION_DECLINE);
            current.setVisitationFeeConfirmedAt(BookingTime.now(clock));
        });
        holdService.releaseHold(engagement.getSelectedProviderId(), engagement.timeBlockJobId());
        notificationService.notifyUser(engagement.getClientId(), "Job Closed",
                "The visitation fee was confirmed and the job is closed.", "visitation_fee_confirmed",
                engagementId, "/jobs/" + engagementId);
        return engagement;
    }

    public Engagement markInvoicePaid(CallerIdentity caller, Long engagementId) {
        Engagement engagement = change("mark invoice paid", engagementId, current -> {
            CallerChecks.requireOwner(caller, current);
            TransitionGuard.requireStatus(current, "mark invoice paid", EngagementStatus.QUOTATION_ACCEPTED);
            current.setStatus(EngagementStatus.COMPLETED_PENDING_PAYMENT);
            current.setInvoicePaidAt(BookingTime.now(clock));
        });
        notificationService.notifyUser(engagement.getSelectedProviderId(), "Invoice Paid",
                "The client marked the invoice as paid. Please confirm the payment.", "invoice_paid",
                engagementId, "/provider/jobs/" + engagementId);
        return engagement;
    }

    public Engagement confirmFinalPayment(CallerIdentity caller, Long engagementId) {
        Engagement engagement = change("confirm final payment", engagementId, current -> {
            CallerChecks.requireAssignee(caller, current);
            TransitionGuard.requireStatus(current, "confirm final payment", EngagementStatus.COMPLETED_PENDING_PAYMENT);
            current.setStatus(EngagementStatus.COMPLETED);
            current.setFinalPaymentConfirmedAt(BookingTime.now(clock));
        });
        notificationService.notifyUser(engagement.getClientId(), "Job Completed",
                "Your provider confirmed the final payment.", "job_completed", engagementId, "/jobs/" + engagementId);
        return engagement;
    }

    /**
     * Cancels the engagement. On a series root the not-yet-confirmed generated occurrences are
     * removed with it; on a single occurrence only that occurrence's block is freed.
     */
    public Engagement cancelByClient(CallerIdentity caller, Long engagementId) {
        return detachProvider(caller, engagementId, "cancel", EngagementStatus.CANCELLED_BY_CLIENT,
                EngagementStatus.REQUESTED, EngagementStatus.ACCEPTED, EngagementStatus.SCHEDULED);
    }

    /**
     * Drops the current provider so the client can hold another one.
     */
    public Engagement rematch(CallerIdentity caller, Long engagementId) {
        return detachProvider(caller, engagementId, "rematch", EngagementStatus.REMATCH,
                EngagementStatus.REQUESTED, EngagementStatus.ACCEPTED, EngagementStatus.SCHEDULED,
                EngagementStatus.DECLINED);
    }

    private Engagement detachProvider(CallerIdentity caller, Long engagementId, String action,
                                      EngagementStatus target, EngagementStatus... allowed) {
        CallerChecks.requireRole(caller, CallerRole.CLIENT);
        Detached detached = transactionRunner.execute(action + " engagement " + engagementId, status -> {
            Engagement current = load(engagementId);
            CallerChecks.requireOwner(caller, current);
            TransitionGuard.requireStatus(current, action, allowed);
            boolean member = current.isRecurringEngagement() && !current.isSeriesRoot();
            if (member && target == EngagementStatus.REMATCH) {
                throw new InvalidInputException("A single occurrence cannot be re-matched; re-match the series root");
            }

            String previousProvider = current.getSelectedProviderId();
            Long jobId = current.timeBlockJobId();
            Integer occurrenceIndex = member ? current.getRecurrenceIndex() : null;
            int removedMembers = 0;
            if (current.isSeriesRoot()) {
                List<Engagement> pending = engagementRepository.findSeriesMembersInStatus(
                        current.effectiveSeriesId(), List.of(EngagementStatus.SCHEDULED));
                engagementRepository.deleteAll(pending);
                removedMembers = pending.size();
            }

            current.setStatus(target);
            current.clearProviderSelection();
            current.setProviderResponseAt(null);
            return new Detached(engagementRepository.save(current), previousProvider, jobId, occurrenceIndex, removedMembers);
        });

        Engagement engagement = detached.engagement();
        logger.info("[EngagementLifecycleService] Engagement {} -> {} by client {} (removed {} pending occurrence(s))",
                engagementId, target.wireValue(), caller.uid(), detached.removedMembers());
        if (detached.previousProvider() != null) {
            if (detached.occurrenceIndex() != null) {
                holdService.releaseOccurrence(detached.previousProvider(), detached.jobId(), detached.occurrenceIndex());
            } else {
                holdService.releaseHold(detached.previousProvider(), detached.jobId());
            }
            String title = target == EngagementStatus.REMATCH ? "Job Reassigned" : "Job Cancelled";
            notificationService.notifyUser(detached.previousProvider(), title,
                    "The client " + (target == EngagementStatus.REMATCH ? "chose another provider for" : "cancelled")
                            + " this job.", "job_" + target.wireValue(), engagementId, "/provider/jobs/" + engagementId);
        }
        return engagement;
    }

    private Engagement change(String action, Long engagementId, Consumer<Engagement> mutation) {
        return transactionRunner.execute(action + " on engagement " + engagementId, status -> {
            Engagement current = load(engagementId);
            mutation.accept(current);
            Engagement saved = engagementRepository.save(current);
            logger.info("[EngagementLifecycleService] Engagement {} -> {} ({})", engagementId,
                    saved.getStatus().wireValue(), action);
            return saved;
        });
    }

    private Engagement load(Long engagementId) {
        return engagementRepository.findById(engagementId)
                .orElseThrow(() -> new NotFoundException("Engagement not found: " + engagementId));
    }

    private static String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }

    private record Detached(Engagement engagement, String previousProvider, Long jobId,
                            Integer occurrenceIndex, int removedMembers) {
    }
}
