package com.handyhub.bookingservice.controller;

import com.handyhub.bookingservice.dto.DecisionRequest;
import com.handyhub.bookingservice.dto.EngagementResponse;
import com.handyhub.bookingservice.dto.HoldRequest;
import com.handyhub.bookingservice.dto.HoldResponse;
import com.handyhub.bookingservice.dto.MatchResponse;
import com.handyhub.bookingservice.security.CallerIdentity;
import com.handyhub.bookingservice.service.EngagementLifecycleService;
import com.handyhub.bookingservice.service.HoldService;
import com.handyhub.bookingservice.service.ProviderMatchService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

/**
 * Matching, holding and the provider's answer to a hold.
 */
@RestController
@RequestMapping("/api/engagements/{id}")
public class BookingController {

    private final ProviderMatchService providerMatchService;
    private final HoldService holdService;
    private final EngagementLifecycleService lifecycleService;

    public BookingController(ProviderMatchService providerMatchService,
                             HoldService holdService,
                             EngagementLifecycleService lifecycleService) {
        this.providerMatchService = providerMatchService;
        this.holdService = holdService;
        this.lifecycleService = lifecycleService;
    }

    @PostMapping("/match-providers")
    public ResponseEntity<MatchResponse> matchProviders(@PathVariable Long id, Authentication authentication) {
        CallerIdentity caller = CallerIdentity.from(authentication);
        return ResponseEntity.ok(MatchResponse.from(providerMatchService.matchProviders(caller, id)));
    }

    @PostMapping("/hold")
    public ResponseEntity<HoldResponse> hold(@PathVariable Long id,
                                             @Valid @RequestBody HoldRequest request,
                                             Authentication authentication) {
        CallerIdentity caller = CallerIdentity.from(authentication);
        return ResponseEntity.ok(HoldResponse.from(holdService.createHolds(caller, id, request.getProviderId())));
    }

    @PostMapping("/cancel-hold")
    public ResponseEntity<EngagementResponse> cancel(@PathVariable Long id, Authentication authentication) {
        CallerIdentity caller = CallerIdentity.from(authentication);
        return ResponseEntity.ok(EngagementResponse.from(lifecycleService.cancelByClient(caller, id)));
    }

    @PostMapping("/rematch")
    public ResponseEntity<EngagementResponse> rematch(@PathVariable Long id, Authentication authentication) {
        CallerIdentity caller = CallerIdentity.from(authentication);
        return ResponseEntity.ok(EngagementResponse.from(lifecycleService.rematch(caller, id)));
    }

    @PostMapping("/respond")
    public ResponseEntity<EngagementResponse> respond(@PathVariable Long id,
                                                      @Valid @RequestBody DecisionRequest request,
                                                      Authentication authentication) {
        CallerIdentity caller = CallerIdentity.from(authentication);
        return ResponseEntity.ok(EngagementResponse.from(lifecycleService.respond(caller, id, request.getDecision())));
    }
}
