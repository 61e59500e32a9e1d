package com.brandish.progression.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Set;

/**
 * Reads and writes the {@code modifier_config} JSON column.
 */
public final class ModifierConfigJsonCodec {

    private static final String FIELD_FEATURE_KEY = "feature_key";
    private static final String FIELD_MODIFIER_TYPE = "modifier_type";
    private static final String FIELD_BASE_VALUE = "base_value";
    private static final String FIELD_PER_LEVEL_VALUE = "per_level_value";
    private static final String FIELD_MAX_VALUE = "max_value";
    private static final String FIELD_MIN_VALUE = "min_value";

    private static final Set<String> ALLOWED_FIELDS = Set.of(
            FIELD_FEATURE_KEY,
            FIELD_MODIFIER_TYPE,
            FIELD_BASE_VALUE,
            FIELD_PER_LEVEL_VALUE,
            FIELD_MAX_VALUE,
            FIELD_MIN_VALUE
    );

    private ModifierConfigJsonCodec() {
    }

    /**
     * @return the parsed config, or {@code null} when the column is empty
     */
    public static ModifierConfig fromJson(JsonNode json) {
        if (json == null || json.isNull() || json.isMissingNode()) {
            return null;
        }
        if (!json.isObject()) {
            throw new IllegalArgumentException("modifier_config must be an object");
        }
        rejectUnexpectedFields(json);

        JsonNode featureKey = json.get(FIELD_FEATURE_KEY);
        if (featureKey == null || !featureKey.isTextual()) {
            throw new IllegalArgumentException("modifier_config.feature_key must be a string");
        }
        JsonNode modifierType = json.get(FIELD_MODIFIER_TYPE);
        if (modifierType == null || !modifierType.isTextual()) {
            throw new IllegalArgumentException("modifier_config.modifier_type must be a string");
        }

        return new ModifierConfig(
                featureKey.asText(),
                ModifierType.fromJsonValue(modifierType.asText()),
                requiredNumber(json, FIELD_BASE_VALUE),
                requiredNumber(json, FIELD_PER_LEVEL_VALUE),
                optionalNumber(json, FIELD_MAX_VALUE),
                optionalNumber(json, FIELD_MIN_VALUE)
        );
    }

    public static ObjectNode toJson(ModifierConfig config) {
        if (config == null) {
            return null;
        }
        ObjectNode json = JsonNodeFactory.instance.objectNode();
        json.put(FIELD_FEATURE_KEY, config.featureKey());
        json.put(FIELD_MODIFIER_TYPE, config.modifierType().jsonValue());
        json.put(FIELD_BASE_VALUE, config.baseValue());
        json.put(FIELD_PER_LEVEL_VALUE, config.perLevelValue());
        if (config.maxValue() != null) {
            json.put(FIELD_MAX_VALUE, config.maxValue());
        }
        if (config.minValue() != null) {
            json.put(FIELD_MIN_VALUE, config.minValue());
        }
        return json;
    }

    private static void rejectUnexpectedFields(JsonNode json) {
        Iterator<String> fieldNames = json.fieldNames();
        while (fieldNames.hasNext()) {
            String fieldName = fieldNames.next();
            if (!ALLOWED_FIELDS.contains(fieldName)) {
                throw new IllegalArgumentException("modifier_config contains unexpected field: " + fieldName);
            }
        }
    }

    private static double requiredNumber(JsonNode json, String fieldName) {
        JsonNode value = json.get(fieldName);
        if (value == null || value.isNull()) {
            return 0.0;
        }
        if (!value.isNumber()) {
            throw new IllegalArgumentException("modifier_config." + fieldName + " must be a number");
        }
        return value.asDouble();
    }

    private static Double optionalNumber(JsonNode json, String fieldName) {
        JsonNode value = json.get(fieldName);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isNumber()) {
            throw new IllegalArgumentException("modifier_config." + fieldName + " must be a number");
        }
        return value.asDouble();
    }
}
