package com.handyhub.bookingservice.controller;

import com.handyhub.bookingservice.dto.DecisionRequest;
import com.handyhub.bookingservice.dto.EngagementResponse;
import com.handyhub.bookingservice.security.CallerIdentity;
import com.handyhub.bookingservice.service.EngagementLifecycleService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

/**
 * Quotation and payment steps after a provider accepted.
 */
@RestController
@RequestMapping("/api/engagements/{id}")
public class PaymentFlowController {

    private final EngagementLifecycleService lifecycleService;

    public PaymentFlowController(EngagementLifecycleService lifecycleService) {
        this.lifecycleService = lifecycleService;
    }

    @PostMapping("/quotation")
    public ResponseEntity<EngagementResponse> createQuotation(@PathVariable Long id, Authentication authentication) {
        CallerIdentity caller = CallerIdentity.from(authentication);
        return ResponseEntity.ok(EngagementResponse.from(lifecycleService.createQuotation(caller, id)));
    }

    @PostMapping("/quotation/decision")
    public ResponseEntity<EngagementResponse> decideQuotation(@PathVariable Long id,
                                                              @Valid @RequestBody DecisionRequest request,
                                                              Authentication authentication) {
        CallerIdentity caller = CallerIdentity.from(authentication);
        return ResponseEntity.ok(EngagementResponse.from(
                lifecycleService.decideQuotation(caller, id, request.getDecision())));
    }

    @PostMapping("/visitation-fee/confirm")
    public ResponseEntity<EngagementResponse> confirmVisitationFee(@PathVariable Long id, Authentication authentication) {
        CallerIdentity caller = CallerIdentity.from(authentication);
        return ResponseEntity.ok(EngagementResponse.from(lifecycleService.confirmVisitationFee(caller, id)));
    }

    @PostMapping("/invoice/paid")
    public ResponseEntity<EngagementResponse> markInvoicePaid(@PathVariable Long id, Authentication authentication) {
        CallerIdentity caller = CallerIdentity.from(authentication);
        return ResponseEntity.ok(EngagementResponse.from(lifecycleService.markInvoicePaid(caller, id)));
    }

    @PostMapping("/final-payment/confirm")
    public ResponseEntity<EngagementResponse> confirmFinalPayment(@PathVariable Long id, Authentication authentication) {
        CallerIdentity caller = CallerIdentity.from(authentication);
        return ResponseEntity.ok(EngagementResponse.from(lifecycleService.confirmFinalPayment(caller, id)));
    }
}
