package com.enterprise.channelnotification.service;

/**
 * What a sweep did with one tracked subscription.
 */
public enum RenewalOutcome {
    RENEWED,      // expiration extended, same id
    RECREATED,    // lost or lapsed, replaced by a new id
    FAILED,       // renewal refused, entry kept for the next sweep
    DROPPED,      // lost and recreation failed, resource unwatched
    SKIPPED       // superseded since the snapshot was taken
}
