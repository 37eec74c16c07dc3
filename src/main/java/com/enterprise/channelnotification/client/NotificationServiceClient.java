package com.enterprise.channelnotification.client;

import com.enterprise.channelnotification.domain.Subscription;

import java.time.Instant;
import java.util.List;

/**
 * Narrow contract the lifecycle manager consumes from the remote notification service.
 * 
 * Implementations report failures through {@link ServiceResult} and must not throw for
 * remote or transport errors. Timeouts are the implementation's concern.
 */
public interface NotificationServiceClient {
    
    /**
     * All subscriptions currently registered for this application, the source of truth
     * for conflict checks.
     */
    ServiceResult<List<Subscription>> list();
    
    /**
     * @param subscription subscription to register, its id is ignored
     * @return the subscription as registered, carrying the assigned id
     */
    ServiceResult<Subscription> create(Subscription subscription);
    
    /**
     * Extends the subscription's lifetime.
     * 
     * @return NOT_FOUND when the service no longer knows the id
     */
    ServiceResult<Subscription> update(String id, Instant expirationDateTime);
    
    ServiceResult<Void> delete(String id);
}
