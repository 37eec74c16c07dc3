package com.enterprise.channelnotification.registry;

import com.enterprise.channelnotification.domain.Subscription;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry of tracked subscriptions, keyed by remote id.
 * 
 * Locking discipline: the registry itself only guarantees atomic single-key
 * operations and torn-free snapshots (entries are immutable). Read-modify-write
 * sequences for one resource are serialized by the caller, see
 * SubscriptionLifecycleManager.
 * 
 * Lifetime is the process lifetime, nothing is persisted.
 */
@Component
@Slf4j
public class SubscriptionRegistry {
    
    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();
    
    /**
     * Insert or replace by id.
     */
    public void upsert(Subscription subscription) {
        Objects.requireNonNull(subscription.getId(), "subscription id");
        Subscription previous = subscriptions.put(subscription.getId(), subscription);
        
        log.debug("Registry upsert: id={}, resource={}, expiration={}, replaced={}",
            subscription.getId(), subscription.getResource(),
            subscription.getExpirationDateTime(), previous != null);
    }
    
    public Optional<Subscription> findById(String id) {
        return Optional.ofNullable(subscriptions.get(id));
    }
    
    /**
     * Entry currently tracked for a resource. The lifecycle manager keeps at most one.
     */
    public Optional<Subscription> findByResource(String resource) {
        return subscriptions.values().stream()
            .filter(s -> resource.equals(s.getResource()))
            .findFirst();
    }
    
    /**
     * All entries tracked for a resource, used to drop superseded ones.
     */
    public List<Subscription> findAllByResource(String resource) {
        return subscriptions.values().stream()
            .filter(s -> resource.equals(s.getResource()))
            .toList();
    }
    
    public boolean remove(String id) {
        boolean removed = subscriptions.remove(id) != null;
        if (removed) {
            log.debug("Registry remove: id={}", id);
        }
        return removed;
    }
    
    /**
     * Point-in-time copy for iteration while other threads keep upserting.
     */
    public List<Subscription> snapshot() {
        return List.copyOf(subscriptions.values());
    }
    
    public int size() {
        return subscriptions.size();
    }
}
