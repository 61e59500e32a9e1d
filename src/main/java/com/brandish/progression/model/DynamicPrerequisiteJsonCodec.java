package com.brandish.progression.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes the {@code dynamic_prerequisites} JSON array.
 */
public final class DynamicPrerequisiteJsonCodec {

    private static final String FIELD_TYPE = "type";
    private static final String FIELD_TIER = "tier";
    private static final String FIELD_COUNT = "count";

    private DynamicPrerequisiteJsonCodec() {
    }

    public static List<DynamicPrerequisite> fromJson(JsonNode json) {
        if (json == null || json.isNull() || json.isMissingNode()) {
            return List.of();
        }
        if (!json.isArray()) {
            throw new IllegalArgumentException("dynamic_prerequisites must be an array");
        }
        List<DynamicPrerequisite> prerequisites = new ArrayList<>(json.size());
        for (JsonNode entry : json) {
            if (!entry.isObject()) {
                throw new IllegalArgumentException("dynamic prerequisite entries must be objects");
            }
            JsonNode type = entry.get(FIELD_TYPE);
            if (type == null || !type.isTextual()) {
                throw new IllegalArgumentException("dynamic prerequisite type must be a string");
            }
            prerequisites.add(new DynamicPrerequisite(
                    DynamicPrerequisiteType.fromJsonValue(type.asText()),
                    entry.path(FIELD_TIER).asInt(0),
                    entry.path(FIELD_COUNT).asInt(0)
            ));
        }
        return List.copyOf(prerequisites);
    }

    public static ArrayNode toJson(List<DynamicPrerequisite> prerequisites) {
        ArrayNode json = JsonNodeFactory.instance.arrayNode();
        if (prerequisites == null) {
            return json;
        }
        for (DynamicPrerequisite prerequisite : prerequisites) {
            ObjectNode entry = json.addObject();
            entry.put(FIELD_TYPE, prerequisite.type().jsonValue());
            if (prerequisite.type() == DynamicPrerequisiteType.NODES_UNLOCKED_BELOW_TIER) {
                entry.put(FIELD_TIER, prerequisite.tier());
            }
            entry.put(FIELD_COUNT, prerequisite.count());
        }
        return json;
    }
}
