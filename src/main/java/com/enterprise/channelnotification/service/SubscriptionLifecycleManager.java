package com.enterprise.channelnotification.service;

import com.enterprise.channelnotification.client.NotificationServiceClient;
import com.enterprise.channelnotification.client.ServiceResult;
import com.enterprise.channelnotification.client.ServiceResult.ServiceError;
import com.enterprise.channelnotification.config.GraphSubscriptionProperties;
import com.enterprise.channelnotification.domain.Subscription;
import com.enterprise.channelnotification.domain.SubscriptionView;
import com.enterprise.channelnotification.registry.SubscriptionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Subscription Lifecycle Manager
 *
 * 5W1H Analysis:
 * WHO: Onboarding callers (startup, REST) and the renewal scheduler
 * WHAT: Creates, reuses, renews and recreates Graph subscriptions
 * WHEN: On every watch request and on every renewal sweep
 * WHERE: Remote Graph /subscriptions, local SubscriptionRegistry
 * WHY: Subscriptions expire within the hour and may be dropped remotely
 * HOW: Remote list is authoritative for conflicts, typed results per call
 *
 * Per resource: Absent -> Creating -> Active <-> Renewing -> Active | Recreating -> Active | Absent.
 *
 * Locking discipline: every read-modify-write of registry entries for one resource
 * runs under that resource's lock, whether it comes from onboarding or from a
 * sweep. Locks are never removed; the number of watched resources is small.
 *
 * No remote failure escapes this class. Unexpected runtime exceptions from the
 * client are logged and treated as OTHER failures.
 */
@Service
@Slf4j
public class SubscriptionLifecycleManager {

    static final String TEAM_CHANNELS_RESOURCE = "/teams/%s/channels";

    private final NotificationServiceClient client;
    private final SubscriptionRegistry registry;
    private final GraphSubscriptionProperties properties;
    private final SubscriptionMonitoringService monitoring;
    private final CreationRetryQueue retryQueue;
    private final Clock clock;

    private final Map<String, ReentrantLock> resourceLocks = new ConcurrentHashMap<>();
    private volatile boolean stopRequested;

    public SubscriptionLifecycleManager(
        NotificationServiceClient client,
        SubscriptionRegistry registry,
        GraphSubscriptionProperties properties,
        SubscriptionMonitoringService monitoring,
        CreationRetryQueue retryQueue,
        Clock clock
    ) {
        this.client = client;
        this.registry = registry;
        this.properties = properties;
        this.monitoring = monitoring;
        this.retryQueue = retryQueue;
        this.clock = clock;
    }

    /**
     * Watch the channel collection of a team.
     *
     * @throws IllegalArgumentException if teamId is blank
     */
    public Optional<SubscriptionView> ensureTeamChannelsSubscription(String teamId) {
        if (teamId == null || teamId.isBlank()) {
            throw new IllegalArgumentException("Team id must not be blank");
        }
        return ensureSubscription(String.format(TEAM_CHANNELS_RESOURCE, teamId.trim()));
    }

    /**
     * Make sure exactly one valid subscription delivers changes of the resource
     * to this host's notification URL.
     *
     * Process Flow:
     * 1. List remote subscriptions and find the one for the resource
     * 2. Delete it if it targets another URL or is already expired
     * 3. Create a new one if none is left
     * 4. Track the valid subscription, dropping superseded entries
     *
     * @return empty if the remote service could not be reached or refused the creation
     * @throws IllegalArgumentException if resource is blank, before any remote call
     */
    public Optional<SubscriptionView> ensureSubscription(String resource) {
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("Resource must not be blank");
        }
        String targetUrl = properties.getNotificationUrl();

        log.info("Ensuring subscription: resource={}, notificationUrl={}", resource, targetUrl);

        return withResourceLock(resource, () -> ensureLocked(resource, targetUrl))
            .map(SubscriptionView::from);
    }

    private Optional<Subscription> ensureLocked(String resource, String targetUrl) {
        Instant now = Instant.now(clock);

        ServiceResult<List<Subscription>> listed = listSubscriptions(resource);
        if (!listed.isSuccess()) {
            log.error("Listing existing subscriptions failed: resource={}, error={}",
                resource, listed.getError());
            monitoring.recordCreationFailed();
            retryQueue.recordFailure(resource);
            return Optional.empty();
        }

        Subscription current = listed.getValue().stream()
            .filter(s -> s.getId() != null)
            .filter(s -> resource.equals(s.getResource()))
            .findFirst()
            .orElse(null);

        if (current != null && !current.isReusableFor(targetUrl, now)) {
            log.warn("Existing subscription not reusable, replacing: id={}, resource={}, notificationUrl={}, expiration={}",
                current.getId(), resource, current.getNotificationUrl(), current.getExpirationDateTime());
            deleteBestEffort(current.getId());
            registry.remove(current.getId());
            monitoring.forget(current.getId());
            current = null;
        }

        if (current == null) {
            Subscription request = buildCreateRequest(resource, targetUrl, now);
            ServiceResult<Subscription> created = createSubscription(resource, request);
            if (!created.isSuccess()) {
                log.error("Creating subscription failed: resource={}, error={}", resource, created.getError());
                monitoring.recordCreationFailed();
                retryQueue.recordFailure(resource);
                return Optional.empty();
            }
            current = completeFrom(created.getValue(), request);
            monitoring.recordCreated();
            log.info("Subscription created: id={}, resource={}, expiration={}",
                current.getId(), resource, current.getExpirationDateTime());
        } else {
            log.info("Reusing existing subscription: id={}, resource={}, expiration={}",
                current.getId(), resource, current.getExpirationDateTime());
        }

        track(current);
        retryQueue.clear(resource);
        return Optional.of(current);
    }

    /**
     * One renewal sweep over a snapshot of the registry.
     *
     * Entries are processed one after the other so the remote service never sees a
     * burst. A stop request is honored between entries; a call in flight completes.
     */
    public RenewalSummary renewAll() {
        List<Subscription> snapshot = registry.snapshot();
        log.info("Renewal sweep started: tracked={}", snapshot.size());

        Map<RenewalOutcome, Integer> outcomes = new EnumMap<>(RenewalOutcome.class);
        boolean interrupted = false;

        for (Subscription entry : snapshot) {
            if (stopRequested) {
                log.info("Renewal sweep interrupted by shutdown");
                interrupted = true;
                break;
            }
            RenewalOutcome outcome;
            try {
                outcome = withResourceLock(entry.getResource(), () -> renewLocked(entry));
            } catch (RuntimeException e) {
                log.error("Renewing subscription failed unexpectedly, continuing sweep: id={}, resource={}",
                    entry.getId(), entry.getResource(), e);
                outcome = RenewalOutcome.FAILED;
            }
            outcomes.merge(outcome, 1, Integer::sum);
        }

        RenewalSummary summary = RenewalSummary.of(snapshot.size(), outcomes, interrupted);
        log.info("Renewal sweep completed: {}", summary);
        return summary;
    }

    private RenewalOutcome renewLocked(Subscription entry) {
        Optional<Subscription> tracked = registry.findById(entry.getId());
        if (tracked.isEmpty()) {
            log.debug("Skipping superseded subscription: id={}", entry.getId());
            return RenewalOutcome.SKIPPED;
        }
        Subscription subscription = tracked.get();
        String id = subscription.getId();
        Instant now = Instant.now(clock);

        if (subscription.isExpiredAt(now)) {
            log.warn("Subscription lapsed before renewal, recreating: id={}, resource={}, expiration={}",
                id, subscription.getResource(), subscription.getExpirationDateTime());
            monitoring.recordLapsed();
            deleteBestEffort(id);
            return recreate(subscription, now);
        }

        Instant requested = now.plus(properties.getExpirationPeriod());
        ServiceResult<Subscription> result = call("update", id, () -> client.update(id, requested));

        if (result.isSuccess()) {
            Instant newExpiration = Optional.ofNullable(result.getValue())
                .map(Subscription::getExpirationDateTime)
                .orElse(requested);
            registry.upsert(subscription.withExpirationDateTime(newExpiration));
            monitoring.recordRenewed(id);
            log.info("Subscription renewed: id={}, newExpiration={}", id, newExpiration);
            return RenewalOutcome.RENEWED;
        }

        ServiceError error = result.getError();
        return switch (error.getKind()) {
            case NOT_FOUND -> {
                log.warn("Subscription lost remotely, recreating: id={}, resource={}",
                    id, subscription.getResource());
                yield recreate(subscription, now);
            }
            case OTHER -> {
                int failures = monitoring.recordRenewalFailed(id);
                log.error("Renewing subscription failed, retrying next sweep: id={}, status={}, message={}, consecutiveFailures={}, expiration={}",
                    id, error.getStatus(), error.getMessage(), failures, subscription.getExpirationDateTime());
                yield RenewalOutcome.FAILED;
            }
        };
    }

    /**
     * Replaces a lost or lapsed subscription. The old id leaves the registry
     * whatever the outcome.
     */
    private RenewalOutcome recreate(Subscription lost, Instant now) {
        String resource = lost.getResource();
        Subscription request = buildCreateRequest(resource, lost.getNotificationUrl(), now);
        ServiceResult<Subscription> created = createSubscription(resource, request);

        registry.remove(lost.getId());
        monitoring.forget(lost.getId());

        if (!created.isSuccess()) {
            log.error("Recreating subscription failed, resource is unwatched: oldId={}, resource={}, error={}",
                lost.getId(), resource, created.getError());
            monitoring.recordCreationFailed();
            retryQueue.recordFailure(resource);
            return RenewalOutcome.DROPPED;
        }

        Subscription replacement = completeFrom(created.getValue(), request);
        track(replacement);
        retryQueue.clear(resource);
        monitoring.recordRecreated();

        log.info("Subscription recreated: oldId={}, newId={}, resource={}, expiration={}",
            lost.getId(), replacement.getId(), resource, replacement.getExpirationDateTime());
        return RenewalOutcome.RECREATED;
    }

    /**
     * Retries creations queued by {@link CreationRetryQueue}. No-op when disabled.
     */
    public void retryPendingCreations() {
        if (!retryQueue.isEnabled()) {
            return;
        }
        for (String resource : retryQueue.dueResources()) {
            if (stopRequested) {
                return;
            }
            log.info("Retrying subscription creation: resource={}, attempts={}",
                resource, retryQueue.getAttempts(resource));
            ensureSubscription(resource);
        }
    }

    public List<SubscriptionView> getTrackedSubscriptions() {
        return registry.snapshot().stream()
            .map(SubscriptionView::from)
            .toList();
    }

    /**
     * Observed at the top of each sweep iteration.
     */
    public void requestStop() {
        stopRequested = true;
    }

    private Subscription buildCreateRequest(String resource, String targetUrl, Instant now) {
        return Subscription.builder()
            .resource(resource)
            .notificationUrl(targetUrl)
            .clientState(properties.getClientState())
            .expirationDateTime(now.plus(properties.getExpirationPeriod()))
            .encryptionCertificate(properties.getEncryptionCertificate())
            .encryptionCertificateId(properties.getEncryptionCertificateId())
            .includeResourceData(properties.isIncludeResourceData())
            .changeTypes(properties.getChangeTypes())
            .build();
    }

    /**
     * The service echoes most fields back; fill whatever it left out from the request.
     */
    private Subscription completeFrom(Subscription created, Subscription request) {
        Subscription.SubscriptionBuilder builder = created.toBuilder();
        if (created.getResource() == null) {
            builder.resource(request.getResource());
        }
        if (created.getNotificationUrl() == null) {
            builder.notificationUrl(request.getNotificationUrl());
        }
        if (created.getExpirationDateTime() == null) {
            builder.expirationDateTime(request.getExpirationDateTime());
        }
        if (created.getChangeTypes().isEmpty()) {
            builder.changeTypes(request.getChangeTypes());
        }
        return builder.build();
    }

    /**
     * Tracks the subscription as the only entry of its resource.
     */
    private void track(Subscription subscription) {
        registry.upsert(subscription);
        for (Subscription other : registry.findAllByResource(subscription.getResource())) {
            if (!other.getId().equals(subscription.getId())) {
                log.info("Dropping superseded subscription: id={}, resource={}, replacedBy={}",
                    other.getId(), other.getResource(), subscription.getId());
                registry.remove(other.getId());
                monitoring.forget(other.getId());
            }
        }
    }

    private ServiceResult<List<Subscription>> listSubscriptions(String resource) {
        ServiceResult<List<Subscription>> listed = call("list", resource, client::list);
        if (listed.isSuccess() && listed.getValue() == null) {
            return ServiceResult.failure(null, "list returned no subscriptions");
        }
        return listed;
    }

    /**
     * A created subscription without an id cannot be tracked or renewed.
     */
    private ServiceResult<Subscription> createSubscription(String resource, Subscription request) {
        ServiceResult<Subscription> created = call("create", resource, () -> client.create(request));
        if (created.isSuccess() && (created.getValue() == null || created.getValue().getId() == null)) {
            return ServiceResult.failure(null, "create returned no subscription id");
        }
        return created;
    }

    private void deleteBestEffort(String id) {
        ServiceResult<Void> deleted = call("delete", id, () -> client.delete(id));
        if (deleted.isSuccess()) {
            log.info("Subscription deleted: id={}", id);
        } else {
            log.warn("Deleting subscription failed, ignored: id={}, error={}", id, deleted.getError());
        }
    }

    private <T> ServiceResult<T> call(String operation, String target, Supplier<ServiceResult<T>> remoteCall) {
        try {
            ServiceResult<T> result = remoteCall.get();
            if (result == null) {
                return ServiceResult.failure(null, operation + " returned no result");
            }
            return result;
        } catch (RuntimeException e) {
            log.error("Unexpected failure calling notification service: operation={}, target={}",
                operation, target, e);
            return ServiceResult.failure(null, e.getMessage());
        }
    }

    private <T> T withResourceLock(String resource, Supplier<T> action) {
        ReentrantLock lock = resourceLocks.computeIfAbsent(resource, key -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
