package com.enterprise.channelnotification.service;

import com.enterprise.channelnotification.config.GraphSubscriptionProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SubscriptionSchedulerTest {
    
    @Mock
    private SubscriptionLifecycleManager lifecycleManager;
    
    private GraphSubscriptionProperties properties;
    private SubscriptionScheduler scheduler;
    
    @BeforeEach
    void setUp() {
        properties = new GraphSubscriptionProperties();
        properties.setBaseUrl("https://host");
        scheduler = new SubscriptionScheduler(lifecycleManager, properties);
    }
    
    @Test
    void testInitializeSubscriptions_EnsuresConfiguredResourcesThenRenews() {
        // Given
        properties.setTeamIds(List.of("T1", "T2"));
        properties.setResources(List.of("/chats/getAllMessages"));
        
        // When
        scheduler.initializeSubscriptions();
        
        // Then
        InOrder inOrder = inOrder(lifecycleManager);
        inOrder.verify(lifecycleManager).ensureTeamChannelsSubscription("T1");
        inOrder.verify(lifecycleManager).ensureTeamChannelsSubscription("T2");
        inOrder.verify(lifecycleManager).ensureSubscription("/chats/getAllMessages");
        inOrder.verify(lifecycleManager).renewAll();
    }
    
    @Test
    void testInitializeSubscriptions_InvalidTeamDoesNotStopOthers() {
        // Given
        properties.setTeamIds(List.of(" ", "T2"));
        when(lifecycleManager.ensureTeamChannelsSubscription(" "))
            .thenThrow(new IllegalArgumentException("Team id must not be blank"));
        
        // When
        assertDoesNotThrow(() -> scheduler.initializeSubscriptions());
        
        // Then
        verify(lifecycleManager).ensureTeamChannelsSubscription("T2");
        verify(lifecycleManager).renewAll();
    }
    
    @Test
    void testRenewSubscriptions_ExceptionDoesNotPropagate() {
        // Given
        when(lifecycleManager.renewAll()).thenThrow(new IllegalStateException("boom"));
        
        // When / Then
        assertDoesNotThrow(() -> scheduler.renewSubscriptions());
    }
    
    @Test
    void testRetryFailedCreations_DelegatesToManager() {
        // When
        scheduler.retryFailedCreations();
        
        // Then
        verify(lifecycleManager).retryPendingCreations();
    }
    
    @Test
    void testShutdown_RequestsStop() {
        // When
        scheduler.shutdown();
        
        // Then
        verify(lifecycleManager).requestStop();
        verifyNoMoreInteractions(lifecycleManager);
    }
}
