package com.enterprise.channelnotification.controller;

import com.enterprise.channelnotification.domain.SubscriptionView;
import com.enterprise.channelnotification.service.RenewalSummary;
import com.enterprise.channelnotification.service.SubscriptionLifecycleManager;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Subscription Controller - onboarding entry point
 * 
 * Endpoints:
 *     POST /api/v1/subscriptions                  watch a raw resource path
 *     POST /api/v1/subscriptions/teams/{teamId}   watch a team's channels
 *     GET  /api/v1/subscriptions                  tracked subscriptions
 *     POST /api/v1/subscriptions/renewal          run a renewal sweep now
 */
@RestController
@RequestMapping("/api/v1/subscriptions")
@RequiredArgsConstructor
@Slf4j
public class SubscriptionController {
    
    private final SubscriptionLifecycleManager lifecycleManager;
    
    @PostMapping
    public ResponseEntity<SubscriptionView> watchResource(
        @Valid @RequestBody WatchResourceRequest request
    ) {
        log.info("Received watch request: resource={}", request.getResource());
        
        SubscriptionView view = lifecycleManager.ensureSubscription(request.getResource())
            .orElseThrow(() -> new SubscriptionUnavailableException(
                "No subscription could be established for " + request.getResource()));
        
        return ResponseEntity.ok(view);
    }
    
    @PostMapping("/teams/{teamId}")
    public ResponseEntity<SubscriptionView> watchTeamChannels(@PathVariable String teamId) {
        log.info("Received watch request: teamId={}", teamId);
        
        SubscriptionView view = lifecycleManager.ensureTeamChannelsSubscription(teamId)
            .orElseThrow(() -> new SubscriptionUnavailableException(
                "No subscription could be established for team " + teamId));
        
        return ResponseEntity.ok(view);
    }
    
    @GetMapping
    public ResponseEntity<List<SubscriptionView>> getSubscriptions() {
        return ResponseEntity.ok(lifecycleManager.getTrackedSubscriptions());
    }
    
    @PostMapping("/renewal")
    public ResponseEntity<RenewalSummary> renewNow() {
        log.info("Manual renewal sweep triggered");
        return ResponseEntity.ok(lifecycleManager.renewAll());
    }
    
    @lombok.Data
    public static class WatchResourceRequest {
        
        @NotBlank(message = "Resource is required")
        private String resource;
    }
    
    /**
     * Exception Handlers
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleInvalidArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("INVALID_RESOURCE", e.getMessage()));
    }
    
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
            .map(FieldError::getDefaultMessage)
            .findFirst()
            .orElse("Invalid request");
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("INVALID_RESOURCE", message));
    }
    
    @ExceptionHandler(SubscriptionUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleUnavailable(SubscriptionUnavailableException e) {
        log.warn("Watch request failed: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
            .body(new ErrorResponse("SUBSCRIPTION_UNAVAILABLE", e.getMessage()));
    }
    
    @lombok.Data
    @lombok.AllArgsConstructor
    public static class ErrorResponse {
        private String errorCode;
        private String message;
    }
    
    public static class SubscriptionUnavailableException extends RuntimeException {
        public SubscriptionUnavailableException(String message) {
            super(message);
        }
    }
}
