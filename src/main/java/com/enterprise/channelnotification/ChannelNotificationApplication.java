package com.enterprise.channelnotification;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Channel Notification Subscription Service
 * 
 * 5W1H:
 * WHO: Receivers of Microsoft Graph change notifications (Teams channels)
 * WHAT: Creates, renews and recreates Graph subscriptions for watched resources
 * WHEN: Starts with the process, sweeps on a fixed cadence until shutdown
 * WHERE: Runs next to the endpoint that receives /api/notifications callbacks
 * WHY: Graph subscriptions expire within the hour and are lost silently
 * HOW: In-memory registry, per-resource locking and a scheduled renewal sweep
 */
@SpringBootApplication
@EnableScheduling
public class ChannelNotificationApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(ChannelNotificationApplication.class, args);
    }
}
