package com.enterprise.channelnotification.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.Set;

/**
 * A remote registration of interest in a resource's change stream.
 * 
 * Immutable so registry snapshots can be handed out without copying entries.
 * A renewal produces a new value through {@link #withExpirationDateTime(Instant)};
 * a recreation produces a new id.
 */
@Value
@Builder(toBuilder = true)
public class Subscription {
    
    /**
     * Assigned by the notification service, null until created
     */
    String id;
    
    /**
     * Logical watched path, e.g. /teams/{teamId}/channels
     */
    String resource;
    
    String notificationUrl;
    
    @ToString.Exclude
    String clientState;
    
    @With
    Instant expirationDateTime;
    
    @ToString.Exclude
    String encryptionCertificate;
    
    String encryptionCertificateId;
    
    boolean includeResourceData;
    
    @Singular
    Set<ChangeType> changeTypes;
    
    public boolean isExpiredAt(Instant instant) {
        return expirationDateTime == null || !expirationDateTime.isAfter(instant);
    }
    
    public boolean isReusableFor(String targetUrl, Instant now) {
        return targetUrl.equals(notificationUrl) && !isExpiredAt(now);
    }
}
