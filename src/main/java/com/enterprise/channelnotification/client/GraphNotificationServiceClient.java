package com.enterprise.channelnotification.client;

import com.azure.core.exception.AzureException;
import com.enterprise.channelnotification.domain.Subscription;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Microsoft Graph Subscription Client
 * 
 * 5W1H Analysis:
 * WHO: SubscriptionLifecycleManager (only caller)
 * WHAT: List / create / renew / delete of Graph change-notification subscriptions
 * WHEN: On onboarding and during every renewal sweep
 * WHERE: {graph.endpoint}/subscriptions, app-only token
 * WHY: Keeps transport and error mapping out of the lifecycle logic
 * HOW: RestTemplate + Jackson, HTTP errors mapped to typed ServiceResult values
 * 
 * Rate limited so a sweep over many subscriptions never bursts the service.
 */
@Component
@Slf4j
public class GraphNotificationServiceClient implements NotificationServiceClient {
    
    static final String SUBSCRIPTIONS_PATH = "/subscriptions";
    static final String SUBSCRIPTION_PATH = "/subscriptions/{id}";
    
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    
    public GraphNotificationServiceClient(
        @Qualifier("graphRestTemplate") RestTemplate restTemplate,
        ObjectMapper objectMapper
    ) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }
    
    /**
     * Follows @odata.nextLink until the last page.
     */
    @Override
    @RateLimiter(name = "graphSubscriptions")
    public ServiceResult<List<Subscription>> list() {
        try {
            List<Subscription> subscriptions = new ArrayList<>();
            GraphSubscriptionPayload.Page page =
                restTemplate.getForObject(SUBSCRIPTIONS_PATH, GraphSubscriptionPayload.Page.class);
            
            while (page != null) {
                page.getValue().forEach(payload -> subscriptions.add(payload.toSubscription()));
                if (page.getNextLink() == null) {
                    break;
                }
                page = restTemplate.getForObject(
                    URI.create(page.getNextLink()),
                    GraphSubscriptionPayload.Page.class
                );
            }
            
            log.debug("Listed {} subscriptions", subscriptions.size());
            return ServiceResult.success(subscriptions);
            
        } catch (RestClientException e) {
            return toFailure("list", null, e);
        } catch (AzureException e) {
            return authenticationFailure("list", null, e);
        }
    }
    
    @Override
    @RateLimiter(name = "graphSubscriptions")
    public ServiceResult<Subscription> create(Subscription subscription) {
        try {
            GraphSubscriptionPayload created = restTemplate.postForObject(
                SUBSCRIPTIONS_PATH,
                GraphSubscriptionPayload.fromSubscription(subscription),
                GraphSubscriptionPayload.class
            );
            
            if (created == null || created.getId() == null) {
                return ServiceResult.failure(null, "Create returned no subscription id");
            }
            
            log.debug("Created subscription: id={}, resource={}", created.getId(), created.getResource());
            return ServiceResult.success(created.toSubscription());
            
        } catch (RestClientException e) {
            return toFailure("create", subscription.getResource(), e);
        } catch (AzureException e) {
            return authenticationFailure("create", subscription.getResource(), e);
        }
    }
    
    @Override
    @RateLimiter(name = "graphSubscriptions")
    public ServiceResult<Subscription> update(String id, Instant expirationDateTime) {
        try {
            ResponseEntity<GraphSubscriptionPayload> response = restTemplate.exchange(
                SUBSCRIPTION_PATH,
                HttpMethod.PATCH,
                new HttpEntity<>(GraphSubscriptionPayload.expirationOnly(expirationDateTime)),
                GraphSubscriptionPayload.class,
                id
            );
            
            GraphSubscriptionPayload body = response.getBody();
            if (body == null) {
                // Graph may answer 204, the requested expiration then applies
                return ServiceResult.success(Subscription.builder()
                    .id(id)
                    .expirationDateTime(expirationDateTime)
                    .build());
            }
            return ServiceResult.success(body.toSubscription());
            
        } catch (RestClientException e) {
            return toFailure("update", id, e);
        } catch (AzureException e) {
            return authenticationFailure("update", id, e);
        }
    }
    
    @Override
    @RateLimiter(name = "graphSubscriptions")
    public ServiceResult<Void> delete(String id) {
        try {
            restTemplate.delete(SUBSCRIPTION_PATH, id);
            return ServiceResult.success(null);
        } catch (RestClientException e) {
            return toFailure("delete", id, e);
        } catch (AzureException e) {
            return authenticationFailure("delete", id, e);
        }
    }
    
    private <T> ServiceResult<T> toFailure(String operation, String target, RestClientException e) {
        if (e instanceof HttpStatusCodeException) {
            HttpStatusCodeException statusException = (HttpStatusCodeException) e;
            int status = statusException.getStatusCode().value();
            String message = extractGraphMessage(statusException);
            
            log.debug("Graph {} failed: target={}, status={}, message={}", operation, target, status, message);
            
            if (status == HttpStatus.NOT_FOUND.value()) {
                return ServiceResult.notFound(message);
            }
            return ServiceResult.failure(status, message);
        }
        
        log.debug("Graph {} transport failure: target={}", operation, target, e);
        return ServiceResult.failure(null, e.getMessage());
    }
    
    private <T> ServiceResult<T> authenticationFailure(String operation, String target, AzureException e) {
        log.debug("Graph {} token acquisition failed: target={}", operation, target, e);
        return ServiceResult.failure(HttpStatus.UNAUTHORIZED.value(), e.getMessage());
    }
    
    /**
     * Graph errors look like {"error":{"code":"...","message":"..."}}
     */
    private String extractGraphMessage(HttpStatusCodeException e) {
        String body = e.getResponseBodyAsString();
        if (body.isBlank()) {
            return e.getStatusText();
        }
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            if (error.hasNonNull("message")) {
                String code = error.path("code").asText("");
                String message = error.get("message").asText();
                return code.isEmpty() ? message : code + ": " + message;
            }
        } catch (JsonProcessingException parseError) {
            log.trace("Graph error body is not JSON: {}", body);
        }
        return body;
    }
}
