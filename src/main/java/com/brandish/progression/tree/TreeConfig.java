package com.brandish.progression.tree;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * JSON shape of {@code progression_tree.json}.
 */
public record TreeConfig(
        String version,
        String description,
        List<NodeConfig> nodes
) {
    public TreeConfig {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
    }

    public record NodeConfig(
            String key,
            String name,
            String type,
            String description,
            int tier,
            String size,
            @JsonProperty("max_level") int maxLevel,
            String category,
            List<String> prerequisites,
            @JsonProperty("sort_order") int sortOrder,
            @JsonProperty("auto_unlock") boolean autoUnlock,
            @JsonProperty("modifier_config") JsonNode modifierConfig
    ) {
        public NodeConfig {
            prerequisites = prerequisites == null ? List.of() : List.copyOf(prerequisites);
        }
    }
}
