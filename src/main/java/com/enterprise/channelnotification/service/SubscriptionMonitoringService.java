package com.enterprise.channelnotification.service;

import com.enterprise.channelnotification.config.GraphSubscriptionProperties;
import com.enterprise.channelnotification.domain.Subscription;
import com.enterprise.channelnotification.registry.SubscriptionRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Subscription Monitoring Service
 * 
 * 5W1H Analysis:
 * WHO: Operations, SRE teams
 * WHAT: Exposes subscription lifecycle metrics
 * WHEN: Updated on every create / renew / recreate, gauges read on scrape
 * WHERE: Micrometer registry, scraped through /actuator/prometheus
 * WHY: A subscription failing renewal sweep after sweep lapses without any
 *      other signal than error logs
 * HOW: Counters per lifecycle event, per-id consecutive renewal failure counts
 * 
 * Key Metrics:
 * 1. Tracked subscriptions
 * 2. Highest consecutive renewal failure count
 * 3. Subscriptions at risk (failing and expiring within one renew interval)
 * 
 * Only observes. Alerting thresholds belong to the monitoring stack.
 */
@Service
@Slf4j
public class SubscriptionMonitoringService {
    
    private final SubscriptionRegistry registry;
    private final GraphSubscriptionProperties properties;
    private final Clock clock;
    
    private final Map<String, Integer> consecutiveRenewalFailures = new ConcurrentHashMap<>();
    
    private final Counter subscriptionsCreatedCounter;
    private final Counter creationFailedCounter;
    private final Counter renewalsCounter;
    private final Counter renewalFailedCounter;
    private final Counter recreationsCounter;
    private final Counter lapsedCounter;
    
    public SubscriptionMonitoringService(
        SubscriptionRegistry registry,
        GraphSubscriptionProperties properties,
        Clock clock,
        MeterRegistry meterRegistry
    ) {
        this.registry = registry;
        this.properties = properties;
        this.clock = clock;
        
        Gauge.builder("graph.subscriptions.tracked", registry, SubscriptionRegistry::size)
            .description("Number of subscriptions tracked in the registry")
            .register(meterRegistry);
        
        Gauge.builder("graph.subscriptions.renewal.consecutive_failures.max", this,
                SubscriptionMonitoringService::getMaxConsecutiveRenewalFailures)
            .description("Highest number of consecutive failed renewals of any tracked subscription")
            .register(meterRegistry);
        
        Gauge.builder("graph.subscriptions.at_risk", this, SubscriptionMonitoringService::countAtRisk)
            .description("Subscriptions failing renewal that expire within one renew interval")
            .register(meterRegistry);
        
        this.subscriptionsCreatedCounter = Counter.builder("graph.subscriptions.created")
            .description("Subscriptions created on first watch")
            .register(meterRegistry);
        
        this.creationFailedCounter = Counter.builder("graph.subscriptions.creation.failed")
            .description("Failed subscription creations")
            .register(meterRegistry);
        
        this.renewalsCounter = Counter.builder("graph.subscriptions.renewed")
            .description("Successful renewals")
            .register(meterRegistry);
        
        this.renewalFailedCounter = Counter.builder("graph.subscriptions.renewal.failed")
            .description("Renewals that failed and were left for the next sweep")
            .register(meterRegistry);
        
        this.recreationsCounter = Counter.builder("graph.subscriptions.recreated")
            .description("Subscriptions recreated after being lost or lapsed")
            .register(meterRegistry);
        
        this.lapsedCounter = Counter.builder("graph.subscriptions.lapsed")
            .description("Tracked subscriptions found already expired by a sweep")
            .register(meterRegistry);
    }
    
    public void recordCreated() {
        subscriptionsCreatedCounter.increment();
    }
    
    public void recordCreationFailed() {
        creationFailedCounter.increment();
    }
    
    public void recordRenewed(String id) {
        renewalsCounter.increment();
        consecutiveRenewalFailures.remove(id);
    }
    
    /**
     * @return consecutive failures for this id including this one
     */
    public int recordRenewalFailed(String id) {
        renewalFailedCounter.increment();
        return consecutiveRenewalFailures.merge(id, 1, Integer::sum);
    }
    
    public void recordRecreated() {
        recreationsCounter.increment();
    }
    
    public void recordLapsed() {
        lapsedCounter.increment();
    }
    
    /**
     * Drops per-id state of a subscription that left the registry.
     */
    public void forget(String id) {
        consecutiveRenewalFailures.remove(id);
    }
    
    public int getConsecutiveRenewalFailures(String id) {
        return consecutiveRenewalFailures.getOrDefault(id, 0);
    }
    
    public int getMaxConsecutiveRenewalFailures() {
        return consecutiveRenewalFailures.values().stream()
            .mapToInt(Integer::intValue)
            .max()
            .orElse(0);
    }
    
    public long countAtRisk() {
        Instant horizon = Instant.now(clock).plus(properties.getRenewInterval());
        return registry.snapshot().stream()
            .filter(s -> getConsecutiveRenewalFailures(s.getId()) > 0)
            .map(Subscription::getExpirationDateTime)
            .filter(expiration -> expiration == null || expiration.isBefore(horizon))
            .count();
    }
}
