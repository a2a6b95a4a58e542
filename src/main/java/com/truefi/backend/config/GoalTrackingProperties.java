package com.truefi.backend.config;

import java.math.BigDecimal;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "truefi.goals")
public record GoalTrackingProperties(
        BigDecimal onTrackTolerance,
        List<Integer> milestones,
        BigDecimal syncEpsilon,
        Integer contributionLookbackDays,
        BigDecimal lowContributionAmount
) {
    public GoalTrackingProperties {
        if (onTrackTolerance == null) {
            onTrackTolerance = new BigDecimal("0.90");
        }
        if (milestones == null || milestones.isEmpty()) {
            milestones = List.of(25, 50, 75, 100);
        } else {
            milestones = milestones.stream().sorted().toList();
        }
        if (syncEpsilon == null) {
            syncEpsilon = new BigDecimal("0.01");
        }
        if (contributionLookbackDays == null) {
            contributionLookbackDays = 90;
        }
        if (lowContributionAmount == null) {
            lowContributionAmount = new BigDecimal("100");
        }
    }

    public static GoalTrackingProperties defaults() {
        return new GoalTrackingProperties(null, null, null, null, null);
    }
}
