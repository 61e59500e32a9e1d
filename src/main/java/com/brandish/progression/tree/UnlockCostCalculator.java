package com.brandish.progression.tree;

import com.brandish.progression.config.ProgressionProperties;
import com.brandish.progression.model.NodeSize;
import org.springframework.stereotype.Component;

/**
 * Unlock cost = round(baseCost(size) * tierScalingFactor ^ tier).
 */
@Component
public class UnlockCostCalculator {

    private final ProgressionProperties progressionProperties;

    public UnlockCostCalculator(ProgressionProperties progressionProperties) {
        this.progressionProperties = progressionProperties;
    }

    public int calculate(int tier, NodeSize size) {
        if (tier < 0) {
            throw new IllegalArgumentException("invalid tier " + tier + ": must be >= 0");
        }
        if (size == null) {
            throw new IllegalArgumentException("invalid size: must be small, medium or large");
        }
        ProgressionProperties.Cost cost = progressionProperties.getCost();
        int baseCost = switch (size) {
            case SMALL -> cost.getBaseSmall();
            case MEDIUM -> cost.getBaseMedium();
            case LARGE -> cost.getBaseLarge();
        };
        return (int) Math.round(baseCost * Math.pow(cost.getTierScalingFactor(), tier));
    }
}
