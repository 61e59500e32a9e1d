package com.brandish.progression.tree;

import com.brandish.progression.model.DynamicPrerequisite;

/**
 * Result of parsing one prerequisite entry: exactly one of {@code staticKey} and
 * {@code dynamicPrerequisite} is set.
 */
public record ParsedPrerequisite(
        String staticKey,
        DynamicPrerequisite dynamicPrerequisite
) {
    public static ParsedPrerequisite staticKey(String key) {
        return new ParsedPrerequisite(key, null);
    }

    public static ParsedPrerequisite dynamic(DynamicPrerequisite prerequisite) {
        return new ParsedPrerequisite(null, prerequisite);
    }

    public boolean isDynamic() {
        return dynamicPrerequisite != null;
    }
}
