package com.brandish.progression.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Unlock-graph change broadcast after the owning transaction commits.
 */
public record ProgressionEvent(
        String type,
        @JsonProperty("node_id") Integer nodeId,
        @JsonProperty("node_key") String nodeKey,
        int level,
        String source,
        @JsonProperty("occurred_at") OffsetDateTime occurredAt
) {
    public static final String NODE_UNLOCKED = "progression.node_unlocked";
    public static final String NODE_RELOCKED = "progression.node_relocked";

    public ProgressionEvent {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(nodeId, "nodeId is required");
    }

    public static ProgressionEvent nodeUnlocked(Integer nodeId, String nodeKey, int level, String source) {
        return new ProgressionEvent(NODE_UNLOCKED, nodeId, nodeKey, level, source, OffsetDateTime.now());
    }

    public static ProgressionEvent nodeRelocked(Integer nodeId, String nodeKey, int level) {
        return new ProgressionEvent(NODE_RELOCKED, nodeId, nodeKey, level, "relock", OffsetDateTime.now());
    }
}
