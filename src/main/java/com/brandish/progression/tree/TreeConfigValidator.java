package com.brandish.progression.tree;

import com.brandish.progression.model.ModifierConfigJsonCodec;
import com.brandish.progression.model.NodeSize;
import com.brandish.progression.model.ProgressionNodeType;
import com.brandish.progression.tree.TreeConfigException.Kind;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural checks on a parsed tree config. Runs before anything touches the database.
 */
public final class TreeConfigValidator {

    private TreeConfigValidator() {
    }

    public static void validate(TreeConfig config) {
        if (config == null || config.nodes().isEmpty()) {
            throw new TreeConfigException(Kind.INVALID_CONFIG, "tree config has no nodes");
        }

        Map<String, TreeConfig.NodeConfig> nodesByKey = new LinkedHashMap<>();
        for (int i = 0; i < config.nodes().size(); i++) {
            TreeConfig.NodeConfig node = config.nodes().get(i);
            if (node.key() == null || node.key().isBlank()) {
                throw new TreeConfigException(Kind.INVALID_CONFIG, "node at index " + i + " has an empty key");
            }
            if (nodesByKey.putIfAbsent(node.key(), node) != null) {
                throw new TreeConfigException(Kind.DUPLICATE_NODE_KEY, "duplicate node key: " + node.key());
            }
            validateNode(node);
        }

        for (TreeConfig.NodeConfig node : config.nodes()) {
            for (String parent : staticPrerequisites(node)) {
                if (!nodesByKey.containsKey(parent)) {
                    throw new TreeConfigException(Kind.MISSING_PARENT,
                            "node '" + node.key() + "' requires unknown node '" + parent + "'");
                }
            }
        }

        detectCycles(nodesByKey);
    }

    /**
     * Static prerequisite keys of a node, in config order. Assumes the entries parse.
     */
    public static List<String> staticPrerequisites(TreeConfig.NodeConfig node) {
        List<String> keys = new ArrayList<>();
        for (String raw : node.prerequisites()) {
            ParsedPrerequisite parsed = PrerequisiteParser.parse(raw);
            if (!parsed.isDynamic()) {
                keys.add(parsed.staticKey());
            }
        }
        return keys;
    }

    private static void validateNode(TreeConfig.NodeConfig node) {
        String key = node.key();
        if (node.name() == null || node.name().isBlank()) {
            throw invalid(key, "name is required");
        }
        try {
            ProgressionNodeType.fromConfigValue(node.type());
        } catch (IllegalArgumentException ex) {
            throw invalid(key, ex.getMessage(), ex);
        }
        if (node.maxLevel() <= 0) {
            throw invalid(key, "max_level must be > 0, got " + node.maxLevel());
        }
        if (node.tier() < 0) {
            throw invalid(key, "tier must be >= 0, got " + node.tier());
        }
        try {
            NodeSize.fromConfigValue(node.size());
        } catch (IllegalArgumentException ex) {
            throw invalid(key, ex.getMessage(), ex);
        }
        if (node.category() == null || node.category().isBlank()) {
            throw invalid(key, "category is required");
        }
        for (String raw : node.prerequisites()) {
            try {
                ParsedPrerequisite parsed = PrerequisiteParser.parse(raw);
                if (parsed.isDynamic()) {
                    PrerequisiteParser.validate(parsed.dynamicPrerequisite());
                }
            } catch (IllegalArgumentException ex) {
                throw invalid(key, "prerequisite '" + raw + "': " + ex.getMessage(), ex);
            }
        }
        try {
            ModifierConfigJsonCodec.fromJson(node.modifierConfig());
        } catch (IllegalArgumentException ex) {
            throw invalid(key, ex.getMessage(), ex);
        }
    }

    private static void detectCycles(Map<String, TreeConfig.NodeConfig> nodesByKey) {
        Map<String, List<String>> edges = new HashMap<>();
        nodesByKey.forEach((key, node) -> edges.put(key, staticPrerequisites(node)));

        Set<String> done = new HashSet<>();
        for (String key : nodesByKey.keySet()) {
            visit(key, edges, new LinkedHashMap<>(), done);
        }
    }

    // onPath keeps insertion order so the error can show the loop.
    private static void visit(String key, Map<String, List<String>> edges, Map<String, Boolean> onPath, Set<String> done) {
        if (done.contains(key)) {
            return;
        }
        if (onPath.containsKey(key)) {
            List<String> path = new ArrayList<>(onPath.keySet());
            path.add(key);
            throw new TreeConfigException(Kind.CYCLE_DETECTED,
                    "circular dependency: " + String.join(" -> ", path.subList(path.indexOf(key), path.size())));
        }
        onPath.put(key, Boolean.TRUE);
        for (String parent : edges.getOrDefault(key, List.of())) {
            visit(parent, edges, onPath, done);
        }
        onPath.remove(key);
        done.add(key);
    }

    private static TreeConfigException invalid(String key, String message) {
        return new TreeConfigException(Kind.INVALID_CONFIG, "node '" + key + "': " + message);
    }

    private static TreeConfigException invalid(String key, String message, Throwable cause) {
        return new TreeConfigException(Kind.INVALID_CONFIG, "node '" + key + "': " + message, cause);
    }
}
