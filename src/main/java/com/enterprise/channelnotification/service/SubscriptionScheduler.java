package com.enterprise.channelnotification.service;

import com.enterprise.channelnotification.config.GraphSubscriptionProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Subscription Scheduler
 * 
 * 5W1H Analysis:
 * WHO: Background scheduling thread (single, see spring.task.scheduling)
 * WHAT: Onboards configured resources, then renews all tracked subscriptions
 * WHEN: Once at startup, then every renew-interval (fixed delay)
 * WHERE: Calls into SubscriptionLifecycleManager
 * WHY: The renew interval is a fraction of the 60 minute validity window so a
 *      couple of failed sweeps still leave time before expiry
 * HOW: @Scheduled fixed delay, sweeps never overlap
 * 
 * Configuration:
 * - graph.subscriptions.renew-interval: sweep cadence
 * - graph.subscriptions.scheduler.enabled: disable the loop entirely
 * - graph.subscriptions.creation-retry.poll-interval: retry queue cadence
 */
@Component
@ConditionalOnProperty(prefix = "graph.subscriptions.scheduler", name = "enabled",
    havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class SubscriptionScheduler {
    
    private final SubscriptionLifecycleManager lifecycleManager;
    private final GraphSubscriptionProperties properties;
    
    /**
     * Startup onboarding: ensure every configured team and resource, then renew.
     * Failures are logged, startup always completes.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void initializeSubscriptions() {
        log.info("Subscription initialization started: teams={}, resources={}",
            properties.getTeamIds().size(), properties.getResources().size());
        
        for (String teamId : properties.getTeamIds()) {
            try {
                lifecycleManager.ensureTeamChannelsSubscription(teamId);
            } catch (IllegalArgumentException e) {
                log.warn("Skipping invalid team id: teamId='{}', reason={}", teamId, e.getMessage());
            }
        }
        
        for (String resource : properties.getResources()) {
            try {
                lifecycleManager.ensureSubscription(resource);
            } catch (IllegalArgumentException e) {
                log.warn("Skipping invalid resource: resource='{}', reason={}", resource, e.getMessage());
            }
        }
        
        renewSubscriptions();
        log.info("Subscription initialization completed");
    }
    
    /**
     * Renewal sweep. The first run waits one interval, startup already swept.
     */
    @Scheduled(
        fixedDelayString = "${graph.subscriptions.renew-interval:PT15M}",
        initialDelayString = "${graph.subscriptions.renew-interval:PT15M}"
    )
    public void renewSubscriptions() {
        try {
            lifecycleManager.renewAll();
        } catch (RuntimeException e) {
            log.error("Error in renewal sweep", e);
            // Continue to next cycle - don't propagate exception
        }
    }
    
    @Scheduled(
        fixedDelayString = "${graph.subscriptions.creation-retry.poll-interval:PT30S}",
        initialDelayString = "${graph.subscriptions.creation-retry.poll-interval:PT30S}"
    )
    public void retryFailedCreations() {
        try {
            lifecycleManager.retryPendingCreations();
        } catch (RuntimeException e) {
            log.error("Error retrying subscription creations", e);
        }
    }
    
    /**
     * Raised before the scheduler is torn down so a running sweep stops between entries.
     */
    @EventListener(ContextClosedEvent.class)
    public void shutdown() {
        log.info("Stopping subscription renewal");
        lifecycleManager.requestStop();
    }
}
