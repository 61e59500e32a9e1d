package com.brandish.progression.model;

/**
 * Numeric effect a node applies to a feature key once unlocked. Bounds are optional.
 */
public record ModifierConfig(
        String featureKey,
        ModifierType modifierType,
        double baseValue,
        double perLevelValue,
        Double maxValue,
        Double minValue
) {
    public ModifierConfig {
        if (featureKey == null || featureKey.isBlank()) {
            throw new IllegalArgumentException("feature_key is required");
        }
        if (modifierType == null) {
            throw new IllegalArgumentException("modifier_type is required");
        }
        featureKey = featureKey.trim();
    }

    /**
     * Applies this modifier at {@code level} to {@code value}. Level 0 means the node is locked
     * and leaves the value unchanged.
     */
    public double apply(double value, int level) {
        if (level <= 0) {
            return value;
        }
        double factor = baseValue + perLevelValue * level;
        double result = modifierType == ModifierType.MULTIPLICATIVE ? value * factor : value + factor;
        if (maxValue != null && result > maxValue) {
            result = maxValue;
        }
        if (minValue != null && result < minValue) {
            result = minValue;
        }
        return result;
    }
}
