package com.enterprise.channelnotification.service;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Counts of one renewal sweep.
 */
@Value
@Builder
public class RenewalSummary {
    int total;
    int renewed;
    int recreated;
    int failed;
    int dropped;
    int skipped;
    boolean interrupted;
    
    static RenewalSummary of(int total, Map<RenewalOutcome, Integer> outcomes, boolean interrupted) {
        return RenewalSummary.builder()
            .total(total)
            .renewed(outcomes.getOrDefault(RenewalOutcome.RENEWED, 0))
            .recreated(outcomes.getOrDefault(RenewalOutcome.RECREATED, 0))
            .failed(outcomes.getOrDefault(RenewalOutcome.FAILED, 0))
            .dropped(outcomes.getOrDefault(RenewalOutcome.DROPPED, 0))
            .skipped(outcomes.getOrDefault(RenewalOutcome.SKIPPED, 0))
            .interrupted(interrupted)
            .build();
    }
}
