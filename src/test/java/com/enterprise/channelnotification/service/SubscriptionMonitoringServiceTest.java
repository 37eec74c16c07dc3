package com.enterprise.channelnotification.service;

import com.enterprise.channelnotification.config.GraphSubscriptionProperties;
import com.enterprise.channelnotification.domain.Subscription;
import com.enterprise.channelnotification.registry.SubscriptionRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit Tests for SubscriptionMonitoringService
 * 
 * Tests:
 * 1. Counters per lifecycle event
 * 2. Consecutive renewal failures reset on success
 * 3. At-risk gauge
 */
class SubscriptionMonitoringServiceTest {
    
    private static final Instant NOW = Instant.parse("2026-10-18T10:00:00Z");
    
    private SimpleMeterRegistry meterRegistry;
    private SubscriptionRegistry registry;
    private SubscriptionMonitoringService monitoring;
    
    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        registry = new SubscriptionRegistry();
        GraphSubscriptionProperties properties = new GraphSubscriptionProperties();
        properties.setBaseUrl("https://host");
        monitoring = new SubscriptionMonitoringService(
            registry, properties, Clock.fixed(NOW, ZoneOffset.UTC), meterRegistry);
    }
    
    @Test
    void testCounters() {
        // When
        monitoring.recordCreated();
        monitoring.recordCreated();
        monitoring.recordRecreated();
        monitoring.recordLapsed();
        monitoring.recordCreationFailed();
        
        // Then
        assertEquals(2.0, meterRegistry.get("graph.subscriptions.created").counter().count());
        assertEquals(1.0, meterRegistry.get("graph.subscriptions.recreated").counter().count());
        assertEquals(1.0, meterRegistry.get("graph.subscriptions.lapsed").counter().count());
        assertEquals(1.0, meterRegistry.get("graph.subscriptions.creation.failed").counter().count());
    }
    
    @Test
    void testRecordRenewalFailed_CountsConsecutiveFailures() {
        // When
        monitoring.recordRenewalFailed("S1");
        int failures = monitoring.recordRenewalFailed("S1");
        monitoring.recordRenewalFailed("S2");
        
        // Then
        assertEquals(2, failures);
        assertEquals(2, monitoring.getMaxConsecutiveRenewalFailures());
        assertEquals(2.0, meterRegistry.get("graph.subscriptions.renewal.consecutive_failures.max").gauge().value());
        assertEquals(3.0, meterRegistry.get("graph.subscriptions.renewal.failed").counter().count());
    }
    
    @Test
    void testRecordRenewed_ResetsFailures() {
        // Given
        monitoring.recordRenewalFailed("S1");
        
        // When
        monitoring.recordRenewed("S1");
        
        // Then
        assertEquals(0, monitoring.getConsecutiveRenewalFailures("S1"));
        assertEquals(1.0, meterRegistry.get("graph.subscriptions.renewed").counter().count());
    }
    
    @Test
    void testCountAtRisk_OnlyFailingAndExpiringSoon() {
        // Given
        registry.upsert(subscription("S1", NOW.plus(Duration.ofMinutes(10))));
        registry.upsert(subscription("S2", NOW.plus(Duration.ofMinutes(50))));
        registry.upsert(subscription("S3", NOW.plus(Duration.ofMinutes(5))));
        monitoring.recordRenewalFailed("S1");
        monitoring.recordRenewalFailed("S2");
        
        // Then
        assertEquals(1, monitoring.countAtRisk());
        assertEquals(1.0, meterRegistry.get("graph.subscriptions.at_risk").gauge().value());
        assertEquals(3.0, meterRegistry.get("graph.subscriptions.tracked").gauge().value());
    }
    
    @Test
    void testForget() {
        // Given
        monitoring.recordRenewalFailed("S1");
        
        // When
        monitoring.forget("S1");
        
        // Then
        assertEquals(0, monitoring.getMaxConsecutiveRenewalFailures());
    }
    
    private static Subscription subscription(String id, Instant expiration) {
        return Subscription.builder()
            .id(id)
            .resource("/teams/" + id + "/channels")
            .notificationUrl("https://host/api/notifications")
            .expirationDateTime(expiration)
            .build();
    }
}
