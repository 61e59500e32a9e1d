package com.brandish.progression.model;

import java.util.Locale;

public enum ModifierType {
    /**
     * value * (base + perLevel * level)
     */
    MULTIPLICATIVE,
    /**
     * value + (base + perLevel * level)
     */
    LINEAR;

    public static ModifierType fromJsonValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("modifier_type is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("unknown modifier_type: " + value, ex);
        }
    }

    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
