package com.enterprise.channelnotification.client;

import com.enterprise.channelnotification.domain.ChangeType;
import com.enterprise.channelnotification.domain.Subscription;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Graph subscription resource as exchanged with /subscriptions
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class GraphSubscriptionPayload {
    
    private String id;
    private String resource;
    private String changeType;
    private String notificationUrl;
    private String clientState;
    
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private OffsetDateTime expirationDateTime;
    
    private String encryptionCertificate;
    private String encryptionCertificateId;
    private Boolean includeResourceData;
    
    public static GraphSubscriptionPayload fromSubscription(Subscription subscription) {
        return GraphSubscriptionPayload.builder()
            .resource(subscription.getResource())
            .changeType(ChangeType.toWireValue(subscription.getChangeTypes()))
            .notificationUrl(subscription.getNotificationUrl())
            .clientState(subscription.getClientState())
            .expirationDateTime(toOffset(subscription.getExpirationDateTime()))
            .encryptionCertificate(subscription.getEncryptionCertificate())
            .encryptionCertificateId(subscription.getEncryptionCertificateId())
            .includeResourceData(subscription.isIncludeResourceData())
            .build();
    }
    
    public static GraphSubscriptionPayload expirationOnly(Instant expirationDateTime) {
        return GraphSubscriptionPayload.builder()
            .expirationDateTime(toOffset(expirationDateTime))
            .build();
    }
    
    public Subscription toSubscription() {
        return Subscription.builder()
            .id(id)
            .resource(resource)
            .changeTypes(ChangeType.fromWireValue(changeType))
            .notificationUrl(notificationUrl)
            .clientState(clientState)
            .expirationDateTime(expirationDateTime == null ? null : expirationDateTime.toInstant())
            .encryptionCertificate(encryptionCertificate)
            .encryptionCertificateId(encryptionCertificateId)
            .includeResourceData(Boolean.TRUE.equals(includeResourceData))
            .build();
    }
    
    private static OffsetDateTime toOffset(Instant instant) {
        return instant == null ? null : instant.atOffset(ZoneOffset.UTC);
    }
    
    /**
     * One page of GET /subscriptions
     */
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Page {
        
        private List<GraphSubscriptionPayload> value = new ArrayList<>();
        
        @JsonProperty("@odata.nextLink")
        private String nextLink;
    }
}
