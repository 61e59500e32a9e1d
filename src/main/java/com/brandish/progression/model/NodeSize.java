package com.brandish.progression.model;

import java.util.Locale;

/**
 * Relative effort of a node. Base unlock costs scale 1:2:4 across sizes.
 */
public enum NodeSize {
    SMALL,
    MEDIUM,
    LARGE;

    public static NodeSize fromConfigValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("invalid size: must be small, medium or large");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(
                    "invalid size '" + value + "': must be small, medium or large", ex);
        }
    }
}
