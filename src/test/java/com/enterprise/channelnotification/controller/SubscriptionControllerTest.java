package com.enterprise.channelnotification.controller;

import com.enterprise.channelnotification.domain.SubscriptionView;
import com.enterprise.channelnotification.service.RenewalSummary;
import com.enterprise.channelnotification.service.SubscriptionLifecycleManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class SubscriptionControllerTest {
    
    @Mock
    private SubscriptionLifecycleManager lifecycleManager;
    
    private MockMvc mockMvc;
    private SubscriptionView view;
    
    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new SubscriptionController(lifecycleManager)).build();
        view = SubscriptionView.builder()
            .id("S1")
            .resource("/teams/T1/channels")
            .notificationUrl("https://host/api/notifications")
            .expirationDateTime(Instant.parse("2026-10-18T11:00:00Z"))
            .changeType("created,deleted,updated")
            .includeResourceData(true)
            .build();
    }
    
    @Test
    void testWatchResource_Success() throws Exception {
        // Given
        when(lifecycleManager.ensureSubscription("/teams/T1/channels")).thenReturn(Optional.of(view));
        
        // When / Then
        mockMvc.perform(post("/api/v1/subscriptions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"resource\": \"/teams/T1/channels\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value("S1"))
            .andExpect(jsonPath("$.changeType").value("created,deleted,updated"));
    }
    
    @Test
    void testWatchResource_MissingResourceRejected() throws Exception {
        // When / Then
        mockMvc.perform(post("/api/v1/subscriptions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("INVALID_RESOURCE"))
            .andExpect(jsonPath("$.message").value("Resource is required"));
        
        verifyNoInteractions(lifecycleManager);
    }
    
    @Test
    void testWatchResource_UnavailableReturnsBadGateway() throws Exception {
        // Given
        when(lifecycleManager.ensureSubscription(anyString())).thenReturn(Optional.empty());
        
        // When / Then
        mockMvc.perform(post("/api/v1/subscriptions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"resource\": \"/teams/T1/channels\"}"))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.errorCode").value("SUBSCRIPTION_UNAVAILABLE"));
    }
    
    @Test
    void testWatchTeamChannels_InvalidTeamReturnsBadRequest() throws Exception {
        // Given
        when(lifecycleManager.ensureTeamChannelsSubscription(" "))
            .thenThrow(new IllegalArgumentException("Team id must not be blank"));
        
        // When / Then
        mockMvc.perform(post("/api/v1/subscriptions/teams/{teamId}", " "))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("INVALID_RESOURCE"))
            .andExpect(jsonPath("$.message").value("Team id must not be blank"));
    }
    
    @Test
    void testWatchTeamChannels_Success() throws Exception {
        // Given
        when(lifecycleManager.ensureTeamChannelsSubscription("T1")).thenReturn(Optional.of(view));
        
        // When / Then
        mockMvc.perform(post("/api/v1/subscriptions/teams/T1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.resource").value("/teams/T1/channels"));
    }
    
    @Test
    void testGetSubscriptions() throws Exception {
        // Given
        when(lifecycleManager.getTrackedSubscriptions()).thenReturn(List.of(view));
        
        // When / Then
        mockMvc.perform(get("/api/v1/subscriptions"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].id").value("S1"))
            .andExpect(jsonPath("$[0].clientState").doesNotExist());
    }
    
    @Test
    void testRenewNow() throws Exception {
        // Given
        when(lifecycleManager.renewAll()).thenReturn(RenewalSummary.builder()
            .total(2)
            .renewed(1)
            .recreated(1)
            .build());
        
        // When / Then
        mockMvc.perform(post("/api/v1/subscriptions/renewal"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(2))
            .andExpect(jsonPath("$.recreated").value(1));
    }
}
