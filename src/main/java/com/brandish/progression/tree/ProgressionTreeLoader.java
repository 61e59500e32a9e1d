package com.brandish.progression.tree;

import com.brandish.progression.config.ProgressionProperties;
import com.brandish.progression.model.DynamicPrerequisite;
import com.brandish.progression.model.DynamicPrerequisiteJsonCodec;
import com.brandish.progression.model.ModifierConfig;
import com.brandish.progression.model.ModifierConfigJsonCodec;
import com.brandish.progression.model.NodeSize;
import com.brandish.progression.model.ProgressionNode;
import com.brandish.progression.model.ProgressionNodeType;
import com.brandish.progression.model.TreeSyncMetadata;
import com.brandish.progression.repository.TreeSyncMetadataRepository;
import com.brandish.progression.service.ModifierService;
import com.brandish.progression.service.UnlockGraphService;
import com.brandish.progression.tree.TreeConfigException.Kind;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Loads {@code progression_tree.json} and brings the node tables in line with it.
 */
@Component
@RequiredArgsConstructor
public class ProgressionTreeLoader {

    public static final String SOURCE_AUTO = "auto";
    static final String SYNC_CONFIG_NAME = "progression_tree.json";

    private static final Logger log = LoggerFactory.getLogger(ProgressionTreeLoader.class);

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final UnlockGraphService unlockGraphService;
    private final UnlockCostCalculator unlockCostCalculator;
    private final ModifierService modifierService;
    private final TreeSyncMetadataRepository treeSyncMetadataRepository;
    private final TransactionTemplate transactionTemplate;
    private final ProgressionProperties progressionProperties;

    public TreeConfig load() {
        return parse(readConfigBytes());
    }

    public TreeConfig parse(byte[] json) {
        TreeConfig config;
        try {
            config = objectMapper.readValue(json, TreeConfig.class);
        } catch (IOException ex) {
            throw new TreeConfigException(Kind.INVALID_CONFIG, "tree config is not valid JSON: " + ex.getMessage(), ex);
        }
        TreeConfigValidator.validate(config);
        return config;
    }

    /**
     * Syncs the configured tree. Skips the work when the file hash matches the last sync unless
     * {@code force} is set.
     */
    public TreeSyncResult sync(boolean force) {
        byte[] bytes = readConfigBytes();
        String fileHash = sha256Hex(bytes);
        if (!force && isUnchanged(fileHash)) {
            log.info("Progression tree config unchanged, skipping sync (path={})", configPath());
            return TreeSyncResult.unchangedFile();
        }

        TreeConfig config = parse(bytes);
        SyncPlan plan = transactionTemplate.execute(status -> applyConfig(config, fileHash));

        // Each auto-unlock commits on its own so one failure does not undo the node sync.
        int autoUnlocked = 0;
        for (Map.Entry<String, Integer> entry : plan.autoUnlockIds().entrySet()) {
            try {
                if (unlockGraphService.unlockNode(entry.getValue(), 1, SOURCE_AUTO, 0L)) {
                    autoUnlocked++;
                    log.info("Auto-unlocked progression node {}", entry.getKey());
                }
            } catch (RuntimeException ex) {
                log.warn("Failed to auto-unlock progression node {}", entry.getKey(), ex);
            }
        }
        if (plan.inserted() > 0 || plan.updated() > 0) {
            modifierService.invalidateAll();
        }

        TreeSyncResult result = new TreeSyncResult(plan.inserted(), plan.updated(), plan.skipped(), autoUnlocked, false);
        log.info("Progression tree sync completed: inserted={}, updated={}, skipped={}, autoUnlocked={}",
                result.inserted(), result.updated(), result.skipped(), result.autoUnlocked());
        return result;
    }

    private SyncPlan applyConfig(TreeConfig config, String fileHash) {
        Map<String, ProgressionNode> existingByKey = new HashMap<>();
        for (ProgressionNode node : unlockGraphService.getAllNodes()) {
            existingByKey.put(node.getNodeKey(), node);
        }
        Map<String, Integer> idsByKey = new HashMap<>();
        existingByKey.forEach((key, node) -> idsByKey.put(key, node.getId()));

        int inserted = 0;
        int updated = 0;
        int skipped = 0;
        Map<String, Integer> autoUnlockIds = new LinkedHashMap<>();

        // Parents first: a node is processed once all of its static prerequisites have ids.
        Set<String> processed = new HashSet<>();
        while (processed.size() < config.nodes().size()) {
            boolean progress = false;
            for (TreeConfig.NodeConfig nodeConfig : config.nodes()) {
                if (processed.contains(nodeConfig.key())) {
                    continue;
                }
                List<String> parentKeys = TreeConfigValidator.staticPrerequisites(nodeConfig);
                boolean parentsReady = processed.containsAll(parentKeys);
                if (!parentsReady) {
                    continue;
                }

                Set<Integer> parentIds = new LinkedHashSet<>();
                parentKeys.forEach(parent -> parentIds.add(idsByKey.get(parent)));
                ProgressionNode existing = existingByKey.get(nodeConfig.key());
                if (existing == null) {
                    ProgressionNode node = unlockGraphService.insertNode(toNode(new ProgressionNode(), nodeConfig));
                    idsByKey.put(node.getNodeKey(), node.getId());
                    unlockGraphService.syncPrerequisites(node.getId(), parentIds);
                    inserted++;
                    log.info("Inserted progression node {} (id={})", node.getNodeKey(), node.getId());
                    if (nodeConfig.autoUnlock()) {
                        autoUnlockIds.put(node.getNodeKey(), node.getId());
                    }
                } else if (needsUpdate(existing, nodeConfig, parentIds)) {
                    unlockGraphService.updateNode(toNode(existing, nodeConfig));
                    unlockGraphService.syncPrerequisites(existing.getId(), parentIds);
                    updated++;
                    log.info("Updated progression node {}", existing.getNodeKey());
                } else {
                    skipped++;
                }
                processed.add(nodeConfig.key());
                progress = true;
            }
            if (!progress) {
                throw new TreeConfigException(Kind.CYCLE_DETECTED,
                        "unable to order nodes for sync, possible circular dependency");
            }
        }

        TreeSyncMetadata metadata = treeSyncMetadataRepository.findById(SYNC_CONFIG_NAME).orElseGet(TreeSyncMetadata::new);
        metadata.setConfigName(SYNC_CONFIG_NAME);
        metadata.setFileHash(fileHash);
        metadata.setLastSyncedAt(OffsetDateTime.now());
        treeSyncMetadataRepository.save(metadata);

        return new SyncPlan(inserted, updated, skipped, autoUnlockIds);
    }

    private ProgressionNode toNode(ProgressionNode target, TreeConfig.NodeConfig config) {
        NodeSize size = NodeSize.fromConfigValue(config.size());
        target.setNodeKey(config.key());
        target.setNodeType(ProgressionNodeType.fromConfigValue(config.type()));
        target.setDisplayName(config.name());
        target.setDescription(config.description());
        target.setMaxLevel(config.maxLevel());
        target.setTier(config.tier());
        target.setSize(size);
        target.setUnlockCost(unlockCostCalculator.calculate(config.tier(), size));
        target.setCategory(config.category());
        target.setSortOrder(config.sortOrder());
        target.setModifierConfig(ModifierConfigJsonCodec.toJson(ModifierConfigJsonCodec.fromJson(config.modifierConfig())));
        target.setDynamicPrerequisites(DynamicPrerequisiteJsonCodec.toJson(dynamicPrerequisites(config)));
        return target;
    }

    private boolean needsUpdate(ProgressionNode existing, TreeConfig.NodeConfig config, Set<Integer> parentIds) {
        NodeSize size = NodeSize.fromConfigValue(config.size());
        boolean fieldsChanged = !Objects.equals(existing.getDisplayName(), config.name())
                || !Objects.equals(existing.getDescription(), config.description())
                || existing.getMaxLevel() != config.maxLevel()
                || existing.getSortOrder() != config.sortOrder()
                || existing.getNodeType() != ProgressionNodeType.fromConfigValue(config.type())
                || existing.getTier() != config.tier()
                || existing.getSize() != size
                || existing.getUnlockCost() != unlockCostCalculator.calculate(config.tier(), size)
                || !Objects.equals(existing.getCategory(), config.category());
        if (fieldsChanged) {
            return true;
        }

        ModifierConfig wanted = ModifierConfigJsonCodec.fromJson(config.modifierConfig());
        List<DynamicPrerequisite> stored;
        ModifierConfig current;
        try {
            current = ModifierConfigJsonCodec.fromJson(existing.getModifierConfig());
            stored = DynamicPrerequisiteJsonCodec.fromJson(existing.getDynamicPrerequisites());
        } catch (IllegalArgumentException ex) {
            log.warn("Stored JSON for node {} is unreadable, rewriting it: {}", existing.getNodeKey(), ex.getMessage());
            return true;
        }
        if (!Objects.equals(current, wanted) || !stored.equals(dynamicPrerequisites(config))) {
            return true;
        }

        Set<Integer> currentParents = new HashSet<>();
        unlockGraphService.getPrerequisites(existing.getId()).forEach(parent -> currentParents.add(parent.getId()));
        return !currentParents.equals(parentIds);
    }

    private static List<DynamicPrerequisite> dynamicPrerequisites(TreeConfig.NodeConfig config) {
        List<DynamicPrerequisite> dynamic = new ArrayList<>();
        for (String raw : config.prerequisites()) {
            ParsedPrerequisite parsed = PrerequisiteParser.parse(raw);
            if (parsed.isDynamic()) {
                dynamic.add(parsed.dynamicPrerequisite());
            }
        }
        return dynamic;
    }

    private boolean isUnchanged(String fileHash) {
        return treeSyncMetadataRepository.findById(SYNC_CONFIG_NAME)
                .map(metadata -> fileHash.equals(metadata.getFileHash()))
                .orElse(false);
    }

    private byte[] readConfigBytes() {
        Resource resource = resourceLoader.getResource(configPath());
        try (InputStream in = resource.getInputStream()) {
            return in.readAllBytes();
        } catch (IOException ex) {
            throw new TreeConfigException(Kind.INVALID_CONFIG, "cannot read tree config " + configPath(), ex);
        }
    }

    private String configPath() {
        return progressionProperties.getTree().getConfigPath();
    }

    static String sha256Hex(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(bytes);
            StringBuilder result = new StringBuilder();
            for (byte b : hash) {
                result.append(String.format("%02x", b));
            }
            return result.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private record SyncPlan(int inserted, int updated, int skipped, Map<String, Integer> autoUnlockIds) {
    }
}
