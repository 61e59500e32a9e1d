package com.brandish.progression.tree;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TreeConfigValidatorTest {

    @Test
    void acceptsWellFormedTree() {
        TreeConfig config = tree(
                node("progression_system", List.of()),
                node("feature_economy", List.of("progression_system")),
                node("feature_crafting", List.of("feature_economy", "-total_nodes_unlocked:2"))
        );

        TreeConfigValidator.validate(config);
        assertEquals(List.of("feature_economy"), TreeConfigValidator.staticPrerequisites(config.nodes().get(2)));
    }

    @Test
    void rejectsEmptyTree() {
        TreeConfigException ex = assertThrows(TreeConfigException.class,
                () -> TreeConfigValidator.validate(new TreeConfig("1", "empty", List.of())));
        assertEquals(TreeConfigException.Kind.INVALID_CONFIG, ex.getKind());
    }

    @Test
    void rejectsDuplicateKeys() {
        TreeConfigException ex = assertThrows(TreeConfigException.class, () -> TreeConfigValidator.validate(tree(
                node("progression_system", List.of()),
                node("progression_system", List.of())
        )));
        assertEquals(TreeConfigException.Kind.DUPLICATE_NODE_KEY, ex.getKind());
    }

    @Test
    void rejectsUnknownParent() {
        TreeConfigException ex = assertThrows(TreeConfigException.class, () -> TreeConfigValidator.validate(tree(
                node("progression_system", List.of()),
                node("feature_economy", List.of("feature_missing"))
        )));
        assertEquals(TreeConfigException.Kind.MISSING_PARENT, ex.getKind());
        assertTrue(ex.getMessage().contains("feature_missing"));
    }

    @Test
    void rejectsCycles() {
        TreeConfigException ex = assertThrows(TreeConfigException.class, () -> TreeConfigValidator.validate(tree(
                node("a", List.of("c")),
                node("b", List.of("a")),
                node("c", List.of("b"))
        )));
        assertEquals(TreeConfigException.Kind.CYCLE_DETECTED, ex.getKind());
    }

    @Test
    void rejectsInvalidNodeFields() {
        assertInvalid(new TreeConfig.NodeConfig("a", "", "feature", null, 0, "small", 1, "core", List.of(), 0, false, null));
        assertInvalid(new TreeConfig.NodeConfig("a", "A", "widget", null, 0, "small", 1, "core", List.of(), 0, false, null));
        assertInvalid(new TreeConfig.NodeConfig("a", "A", "feature", null, 0, "small", 0, "core", List.of(), 0, false, null));
        assertInvalid(new TreeConfig.NodeConfig("a", "A", "feature", null, -1, "small", 1, "core", List.of(), 0, false, null));
        assertInvalid(new TreeConfig.NodeConfig("a", "A", "feature", null, 0, "huge", 1, "core", List.of(), 0, false, null));
        assertInvalid(new TreeConfig.NodeConfig("a", "A", "feature", null, 0, "small", 1, " ", List.of(), 0, false, null));
        assertInvalid(new TreeConfig.NodeConfig("a", "A", "feature", null, 0, "small", 1, "core",
                List.of("-total_nodes_unlocked:0"), 0, false, null));
    }

    @Test
    void rejectsMalformedModifierConfig() {
        ObjectNode modifier = JsonNodeFactory.instance.objectNode();
        modifier.put("feature_key", "progression_rate");
        modifier.put("modifier_type", "exponential");

        assertInvalid(new TreeConfig.NodeConfig("a", "A", "upgrade", null, 0, "small", 1, "core",
                List.of(), 0, false, modifier));
    }

    private static void assertInvalid(TreeConfig.NodeConfig node) {
        TreeConfigException ex = assertThrows(TreeConfigException.class,
                () -> TreeConfigValidator.validate(tree(node)));
        assertEquals(TreeConfigException.Kind.INVALID_CONFIG, ex.getKind());
    }

    private static TreeConfig tree(TreeConfig.NodeConfig... nodes) {
        return new TreeConfig("1.0", "test tree", List.of(nodes));
    }

    private static TreeConfig.NodeConfig node(String key, List<String> prerequisites) {
        return new TreeConfig.NodeConfig(key, key, "feature", null, 0, "small", 1, "core",
                prerequisites, 0, false, null);
    }
}
