package com.brandish.progression.model;

public enum DynamicPrerequisiteType {
    NODES_UNLOCKED_BELOW_TIER("nodes_unlocked_below_tier"),
    TOTAL_NODES_UNLOCKED("total_nodes_unlocked");

    private final String jsonValue;

    DynamicPrerequisiteType(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    public String jsonValue() {
        return jsonValue;
    }

    public static DynamicPrerequisiteType fromJsonValue(String value) {
        for (DynamicPrerequisiteType type : values()) {
            if (type.jsonValue.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown dynamic prerequisite type: " + value);
    }
}
