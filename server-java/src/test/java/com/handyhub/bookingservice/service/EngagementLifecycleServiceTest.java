package com.handyhub.bookingservice.service;

import com.handyhub.bookingservice.exception.ConflictException;
import com.handyhub.bookingservice.exception.ForbiddenException;
import com.handyhub.bookingservice.exception.InvalidInputException;
import com.handyhub.bookingservice.model.CallerRole;
import com.handyhub.bookingservice.model.Engagement;
import com.handyhub.bookingservice.model.EngagementStatus;
import com.handyhub.bookingservice.model.ProviderDecision;
import com.handyhub.bookingservice.repository.EngagementRepository;
import com.handyhub.bookingservice.repository.ServiceProviderRepository;
import com.handyhub.bookingservice.security.CallerIdentity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static com.handyhub.bookingservice.service.BookingFixtures.NOW;
import static com.handyhub.bookingservice.service.BookingFixtures.oneOff;
import static com.handyhub.bookingservice.service.BookingFixtures.weeklyRoot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class EngagementLifecycleServiceTest {

    private static final String CLIENT = "client-1";
    private static final String PROVIDER = "provider-1";
    private static final LocalDateTime START = LocalDateTime.of(2025, 6, 10, 10, 0);

    @Mock
    private EngagementRepository engagementRepository;

    @Mock
    private ServiceProviderRepository serviceProviderRepository;

    @Mock
    private HoldService holdService;

    @Mock
    private NotificationService notificationService;

    @Mock
    private PlatformTransactionManager transactionManager;

    private EngagementLifecycleService lifecycleService;
    private final CallerIdentity client = new CallerIdentity(CLIENT, CallerRole.CLIENT);
    private final CallerIdentity provider = new CallerIdentity(PROVIDER, CallerRole.PROVIDER);

    @BeforeEach
    void setUp() {
        lifecycleService = new EngagementLifecycleService(engagementRepository, serviceProviderRepository, holdService,
                notificationService, new TransactionRunner(transactionManager, 3), BookingFixtures.fixedClock());
        when(engagementRepository.save(any(Engagement.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    private Engagement stored(Engagement engagement) {
        when(engagementRepository.findById(engagement.getId())).thenReturn(Optional.of(engagement));
        return engagement;
    }

    private Engagement requested(Long id) {
        Engagement engagement = oneOff(id, CLIENT, START);
        engagement.setStatus(EngagementStatus.REQUESTED);
        engagement.setSelectedProviderId(PROVIDER);
        engagement.setHoldExpiresAt(NOW.plusMinutes(10));
        return stored(engagement);
    }

    @Test
    void providerAcceptBooksTheHolds() {
        Engagement engagement = requested(5L);

        Engagement result = lifecycleService.respond(provider, 5L, ProviderDecision.ACCEPTED);

        assertThat(result.getStatus()).isEqualTo(EngagementStatus.ACCEPTED);
        assertThat(result.getProviderResponseAt()).isEqualTo(NOW);
        assertThat(result.getHoldExpiresAt()).isNull();
        InOrder order = inOrder(serviceProviderRepository, holdService);
        order.verify(serviceProviderRepository).bumpScheduleVersion(PROVIDER);
        order.verify(holdService).resolveHolds(PROVIDER, 5L, ProviderDecision.ACCEPTED);
        verify(notificationService).notifyUser(eq(CLIENT), anyString(), anyString(), eq("job_accepted"), eq(5L), anyString());
        assertThat(engagement.getSelectedProviderId()).isEqualTo(PROVIDER);
    }

    @Test
    void providerDeclineClearsTheSelectionAndDropsBlocks() {
        requested(5L);

        Engagement result = lifecycleService.respond(provider, 5L, ProviderDecision.DECLINED);

        assertThat(result.getStatus()).isEqualTo(EngagementStatus.DECLINED);
        assertThat(result.getSelectedProviderId()).isNull();
        verify(holdService).resolveHolds(PROVIDER, 5L, ProviderDecision.DECLINED);
    }

    @Test
    void onlyTheAssignedProviderMayRespond() {
        requested(5L);

        assertThrows(ForbiddenException.class, () -> lifecycleService.respond(
                new CallerIdentity("provider-2", CallerRole.PROVIDER), 5L, ProviderDecision.ACCEPTED));
        assertThrows(ForbiddenException.class, () -> lifecycleService.respond(client, 5L, ProviderDecision.ACCEPTED));
        verify(holdService, never()).resolveHolds(anyString(), anyLong(), any());
    }

    @Test
    void respondingTwiceIsAStateConflict() {
        Engagement engagement = requested(5L);
        engagement.setStatus(EngagementStatus.ACCEPTED);

        ConflictException conflict = assertThrows(ConflictException.class,
                () -> lifecycleService.respond(provider, 5L, ProviderDecision.ACCEPTED));
        assertThat(conflict.getDetails()).containsEntry("status", "accepted");
    }

    @Test
    void quotationAndPaymentFlowRunsToCompletion() {
        Engagement engagement = requested(5L);
        engagement.setStatus(EngagementStatus.ACCEPTED);

        lifecycleService.createQuotation(provider, 5L);
        assertThat(engagement.getStatus()).isEqualTo(EngagementStatus.QUOTATION_CREATED);
        assertThat(engagement.getQuotationCreatedAt()).isEqualTo(NOW);

        lifecycleService.decideQuotation(client, 5L, ProviderDecision.ACCEPTED);
        assertThat(engagement.getStatus()).isEqualTo(EngagementStatus.QUOTATION_ACCEPTED);

        lifecycleService.markInvoicePaid(client, 5L);
        assertThat(engagement.getStatus()).isEqualTo(EngagementStatus.COMPLETED_PENDING_PAYMENT);

        lifecycleService.confirmFinalPayment(provider, 5L);
        assertThat(engagement.getStatus()).isEqualTo(EngagementStatus.COMPLETED);
        assertThat(engagement.getFinalPaymentConfirmedAt()).isEqualTo(NOW);
    }

    @Test
    void declinedQuotationEndsAfterVisitationFee() {
        Engagement engagement = requested(5L);
        engagement.setStatus(EngagementStatus.QUOTATION_CREATED);

        lifecycleService.decideQuotation(client, 5L, ProviderDecision.DECLINED);
        assertThat(engagement.getStatus()).isEqualTo(EngagementStatus.QUOTATION_DECLINED_PENDING_VISITATION);

        lifecycleService.confirmVisitationFee(provider, 5L);
        assertThat(engagement.getStatus()).isEqualTo(EngagementStatus.TERMINATED_AFTER_QUOTATION_DECLINE);
        verify(holdService).releaseHold(PROVIDER, 5L);
    }

    @Test
    void clientCannotConfirmProviderSteps() {
        Engagement engagement = requested(5L);
        engagement.setStatus(EngagementStatus.ACCEPTED);

        assertThrows(ForbiddenException.class, () -> lifecycleService.createQuotation(client, 5L));
        assertThat(engagement.getStatus()).isEqualTo(EngagementStatus.ACCEPTED);
    }

    @Test
    void cancelByClientReleasesTheHoldAfterCommit() {
        requested(5L);

        Engagement result = lifecycleService.cancelByClient(client, 5L);

        assertThat(result.getStatus()).isEqualTo(EngagementStatus.CANCELLED_BY_CLIENT);
        assertThat(result.getSelectedProviderId()).isNull();
        InOrder order = inOrder(transactionManager, holdService);
        order.verify(transactionManager).commit(any());
        order.verify(holdService).releaseHold(PROVIDER, 5L);
        verify(notificationService).notifyUser(eq(PROVIDER), anyString(), anyString(), anyString(), eq(5L), anyString());
    }

    @Test
    void cancellingOneOccurrenceReleasesOnlyItsBlock() {
        Engagement member = oneOff(12L, CLIENT, START.plusWeeks(2));
        member.setRecurring(true);
        member.setRecurrenceSeriesId(5L);
        member.setRecurrenceIndex(2);
        member.setStatus(EngagementStatus.SCHEDULED);
        member.setSelectedProviderId(PROVIDER);
        stored(member);

        lifecycleService.cancelByClient(client, 12L);

        verify(holdService).releaseOccurrence(PROVIDER, 5L, 2);
        verify(holdService, never()).releaseHold(anyString(), anyLong());
    }

    @Test
    void rematchOfSeriesRootDropsPendingOccurrences() {
        Engagement root = weeklyRoot(5L, CLIENT, START, 4);
        root.setRecurrenceSeriesId(5L);
        root.setRecurrenceIndex(0);
        root.setStatus(EngagementStatus.ACCEPTED);
        root.setSelectedProviderId(PROVIDER);
        stored(root);
        Engagement pending = oneOff(6L, CLIENT, START.plusWeeks(1));
        when(engagementRepository.findSeriesMembersInStatus(5L, List.of(EngagementStatus.SCHEDULED)))
                .thenReturn(List.of(pending));

        Engagement result = lifecycleService.rematch(client, 5L);

        assertThat(result.getStatus()).isEqualTo(EngagementStatus.REMATCH);
        verify(engagementRepository).deleteAll(List.of(pending));
        verify(holdService).releaseHold(PROVIDER, 5L);
    }

    @Test
    void rematchOfSingleOccurrenceIsRejected() {
        Engagement member = oneOff(12L, CLIENT, START);
        member.setRecurring(true);
        member.setRecurrenceSeriesId(5L);
        member.setRecurrenceIndex(1);
        member.setStatus(EngagementStatus.SCHEDULED);
        stored(member);

        assertThrows(InvalidInputException.class, () -> lifecycleService.rematch(client, 12L));
    }

    @Test
    void completedEngagementCannotBeCancelled() {
        Engagement engagement = requested(5L);
        engagement.setStatus(EngagementStatus.COMPLETED);

        assertThrows(ConflictException.class, () -> lifecycleService.cancelByClient(client, 5L));
        verify(holdService, never()).releaseHold(anyString(), anyLong());
    }
}
