package com.brandish.progression.tree;

import com.brandish.progression.model.DynamicPrerequisite;
import com.brandish.progression.model.DynamicPrerequisiteType;

/**
 * Parses prerequisite entries from the tree config.
 * <ul>
 *     <li>{@code node_key}: static edge to another node</li>
 *     <li>{@code -nodes_unlocked_below_tier:T:N}: at least N distinct nodes below tier T unlocked</li>
 *     <li>{@code -total_nodes_unlocked:N}: at least N distinct nodes unlocked</li>
 * </ul>
 */
public final class PrerequisiteParser {

    private static final String DYNAMIC_PREFIX = "-";
    private static final String SEPARATOR = ":";

    private PrerequisiteParser() {
    }

    public static ParsedPrerequisite parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("invalid syntax: prerequisite is empty");
        }
        String value = raw.trim();
        if (!value.startsWith(DYNAMIC_PREFIX)) {
            return ParsedPrerequisite.staticKey(value);
        }

        String[] parts = value.substring(DYNAMIC_PREFIX.length()).split(SEPARATOR, -1);
        DynamicPrerequisiteType type = DynamicPrerequisiteType.fromJsonValue(parts[0]);
        return switch (type) {
            case NODES_UNLOCKED_BELOW_TIER -> {
                if (parts.length != 3) {
                    throw new IllegalArgumentException(
                            "invalid syntax: expected -nodes_unlocked_below_tier:<tier>:<count>, got " + value);
                }
                yield ParsedPrerequisite.dynamic(DynamicPrerequisite.nodesUnlockedBelowTier(
                        parseInt(parts[1], "invalid tier", value),
                        parseInt(parts[2], "invalid count", value)
                ));
            }
            case TOTAL_NODES_UNLOCKED -> {
                if (parts.length != 2) {
                    throw new IllegalArgumentException(
                            "invalid syntax: expected -total_nodes_unlocked:<count>, got " + value);
                }
                yield ParsedPrerequisite.dynamic(DynamicPrerequisite.totalNodesUnlocked(
                        parseInt(parts[1], "invalid count", value)
                ));
            }
        };
    }

    public static void validate(DynamicPrerequisite prerequisite) {
        if (prerequisite == null) {
            throw new IllegalArgumentException("prerequisite is nil");
        }
        if (prerequisite.count() <= 0) {
            throw new IllegalArgumentException("count must be > 0, got " + prerequisite.count());
        }
        if (prerequisite.type() == DynamicPrerequisiteType.NODES_UNLOCKED_BELOW_TIER && prerequisite.tier() < 0) {
            throw new IllegalArgumentException("invalid tier " + prerequisite.tier() + ": must be >= 0");
        }
    }

    private static int parseInt(String value, String errorPrefix, String raw) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(errorPrefix + " '" + value + "' in " + raw, ex);
        }
    }
}
