package com.enterprise.channelnotification.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Read model handed to onboarding callers. Client state and certificate stay internal.
 */
@Value
@Builder
public class SubscriptionView {
    String id;
    String resource;
    String notificationUrl;
    Instant expirationDateTime;
    String changeType;
    boolean includeResourceData;
    
    public static SubscriptionView from(Subscription subscription) {
        return SubscriptionView.builder()
            .id(subscription.getId())
            .resource(subscription.getResource())
            .notificationUrl(subscription.getNotificationUrl())
            .expirationDateTime(subscription.getExpirationDateTime())
            .changeType(ChangeType.toWireValue(subscription.getChangeTypes()))
            .includeResourceData(subscription.isIncludeResourceData())
            .build();
    }
}
