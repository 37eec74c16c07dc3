package com.enterprise.channelnotification.service;

import com.enterprise.channelnotification.config.GraphSubscriptionProperties;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resources whose subscription could not be created, with a per-resource
 * failure counter and exponential backoff.
 * 
 * Opt-in (graph.subscriptions.creation-retry.enabled). When disabled a failed
 * creation is only retried by the next explicit onboarding call.
 */
@Component
@Slf4j
public class CreationRetryQueue {
    
    private final GraphSubscriptionProperties.CreationRetry settings;
    private final Clock clock;
    private final Map<String, PendingCreation> pending = new ConcurrentHashMap<>();
    
    public CreationRetryQueue(GraphSubscriptionProperties properties, Clock clock) {
        this.settings = properties.getCreationRetry();
        this.clock = clock;
    }
    
    public boolean isEnabled() {
        return settings.isEnabled();
    }
    
    /**
     * Records a failed creation. Once max-attempts is reached the resource is dropped.
     */
    public void recordFailure(String resource) {
        if (!isEnabled()) {
            return;
        }
        
        PendingCreation entry = pending.computeIfAbsent(resource, PendingCreation::new);
        entry.markAsFailed(Instant.now(clock), settings.getBaseBackoff(), settings.getMaxBackoff());
        
        if (entry.getAttempts() >= settings.getMaxAttempts()) {
            pending.remove(resource);
            log.error("Giving up creating subscription: resource={}, attempts={}",
                resource, entry.getAttempts());
            return;
        }
        
        log.warn("Subscription creation queued for retry: resource={}, attempts={}, nextAttemptAt={}",
            resource, entry.getAttempts(), entry.getNextAttemptAt());
    }
    
    public void clear(String resource) {
        if (pending.remove(resource) != null) {
            log.info("Subscription creation retry cleared: resource={}", resource);
        }
    }
    
    /**
     * Resources whose backoff has elapsed.
     */
    public List<String> dueResources() {
        Instant now = Instant.now(clock);
        return pending.values().stream()
            .filter(entry -> !entry.getNextAttemptAt().isAfter(now))
            .map(PendingCreation::getResource)
            .toList();
    }
    
    public int getAttempts(String resource) {
        PendingCreation entry = pending.get(resource);
        return entry == null ? 0 : entry.getAttempts();
    }
    
    public int size() {
        return pending.size();
    }
    
    @Getter
    static class PendingCreation {
        
        private final String resource;
        // written under the resource lock, read by the retry poll
        private volatile int attempts;
        private volatile Instant nextAttemptAt = Instant.MIN;
        
        PendingCreation(String resource) {
            this.resource = resource;
        }
        
        /**
         * Exponential backoff: base * 2^(attempts - 1), capped
         */
        void markAsFailed(Instant now, Duration base, Duration max) {
            attempts++;
            long factor = 1L << Math.min(attempts - 1, 20);
            Duration backoff = base.multipliedBy(factor);
            if (backoff.compareTo(max) > 0) {
                backoff = max;
            }
            nextAttemptAt = now.plus(backoff);
        }
    }
}
