package com.brandish.progression.model;

import java.util.Locale;

public enum ProgressionNodeType {
    FEATURE,
    ITEM,
    UPGRADE,
    JOB,
    SYSTEM;

    public static ProgressionNodeType fromConfigValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("node type is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("unknown node type: " + value, ex);
        }
    }
}
