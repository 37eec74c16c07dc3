package com.enterprise.channelnotification.config;

import com.enterprise.channelnotification.domain.ChangeType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Graph Subscription Configuration Properties
 * 
 * Binds graph.subscriptions.* from application.yml to type-safe configuration
 */
@Configuration
@ConfigurationProperties(prefix = "graph.subscriptions")
@Validated
@Data
public class GraphSubscriptionProperties {
    
    /**
     * Public base URL of this host, notifications are delivered to baseUrl + notificationPath
     */
    @NotBlank
    private String baseUrl;
    
    @NotBlank
    private String notificationPath = "/api/notifications";
    
    private String clientState = "ClientState";
    
    @NotNull
    private Duration expirationPeriod = Duration.ofMinutes(60);
    
    @NotNull
    private Duration renewInterval = Duration.ofMinutes(15);
    
    private boolean includeResourceData = true;
    
    @NotEmpty
    private Set<ChangeType> changeTypes = EnumSet.allOf(ChangeType.class);
    
    private String encryptionCertificate;
    private String encryptionCertificateId;
    
    /**
     * Teams whose channel collection is watched from startup
     */
    private List<String> teamIds = new ArrayList<>();
    
    /**
     * Additional raw resource paths watched from startup
     */
    private List<String> resources = new ArrayList<>();
    
    @Valid
    private Scheduler scheduler = new Scheduler();
    
    @Valid
    private Graph graph = new Graph();
    
    @Valid
    private CreationRetry creationRetry = new CreationRetry();
    
    public String getNotificationUrl() {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return base + notificationPath;
    }
    
    @AssertTrue(message = "renew-interval must be strictly shorter than expiration-period")
    public boolean isRenewIntervalShorterThanExpiration() {
        return renewInterval == null
            || expirationPeriod == null
            || renewInterval.compareTo(expirationPeriod) < 0;
    }
    
    @Data
    public static class Scheduler {
        private boolean enabled = true;
    }
    
    @Data
    public static class Graph {
        @NotBlank
        private String endpoint = "https://graph.microsoft.com/beta";
        private String tenantId;
        private String clientId;
        private String clientSecret;
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);
        @NotNull
        private Duration readTimeout = Duration.ofSeconds(30);
    }
    
    @Data
    public static class CreationRetry {
        private boolean enabled = false;
        @Min(1)
        private int maxAttempts = 5;
        @NotNull
        private Duration baseBackoff = Duration.ofSeconds(30);
        @NotNull
        private Duration maxBackoff = Duration.ofMinutes(15);
        @NotNull
        private Duration pollInterval = Duration.ofSeconds(30);
    }
}
