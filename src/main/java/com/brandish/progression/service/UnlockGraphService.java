package com.brandish.progression.service;

import com.brandish.progression.event.ProgressionEvent;
import com.brandish.progression.event.ProgressionEventPublisher;
import com.brandish.progression.model.DynamicPrerequisite;
import com.brandish.progression.model.DynamicPrerequisiteJsonCodec;
import com.brandish.progression.model.ProgressionNode;
import com.brandish.progression.model.ProgressionPrerequisite;
import com.brandish.progression.model.UnlockProgress;
import com.brandish.progression.repository.NodeLevelRow;
import com.brandish.progression.repository.ProgressionNodeRepository;
import com.brandish.progression.repository.ProgressionPrerequisiteRepository;
import com.brandish.progression.repository.ProgressionUnlockRepository;
import com.brandish.progression.tree.TreeConfigException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The shared unlock tree: nodes, prerequisite edges and which (node, level) pairs are unlocked.
 */
@Service
@RequiredArgsConstructor
public class UnlockGraphService {

    private static final Logger log = LoggerFactory.getLogger(UnlockGraphService.class);

    private final ProgressionNodeRepository progressionNodeRepository;
    private final ProgressionPrerequisiteRepository progressionPrerequisiteRepository;
    private final ProgressionUnlockRepository progressionUnlockRepository;
    private final UnlockProgressService unlockProgressService;
    private final ProgressionEventPublisher progressionEventPublisher;

    @Transactional(readOnly = true)
    public Optional<ProgressionNode> getNodeByKey(String nodeKey) {
        return progressionNodeRepository.findByNodeKey(nodeKey);
    }

    @Transactional(readOnly = true)
    public Optional<ProgressionNode> getNodeById(Integer nodeId) {
        return progressionNodeRepository.findById(nodeId);
    }

    @Transactional(readOnly = true)
    public ProgressionNode requireNodeByKey(String nodeKey) {
        return progressionNodeRepository.findByNodeKey(nodeKey)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Node not found: " + nodeKey));
    }

    @Transactional(readOnly = true)
    public List<ProgressionNode> getAllNodes() {
        return progressionNodeRepository.findAllByOrderByTierAscSortOrderAscIdAsc();
    }

    @Transactional
    public ProgressionNode insertNode(ProgressionNode node) {
        if (node.getId() != null) {
            throw new IllegalArgumentException("New node must not carry an id: " + node.getNodeKey());
        }
        OffsetDateTime now = OffsetDateTime.now();
        node.setCreatedAt(now);
        node.setUpdatedAt(now);
        return progressionNodeRepository.saveAndFlush(node);
    }

    @Transactional
    public ProgressionNode updateNode(ProgressionNode node) {
        if (node.getId() == null || !progressionNodeRepository.existsById(node.getId())) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Node not found: " + node.getNodeKey());
        }
        node.setUpdatedAt(OffsetDateTime.now());
        return progressionNodeRepository.saveAndFlush(node);
    }

    @Transactional(readOnly = true)
    public List<ProgressionNode> getPrerequisites(Integer nodeId) {
        List<Integer> prerequisiteIds = progressionPrerequisiteRepository.findByNodeId(nodeId).stream()
                .map(ProgressionPrerequisite::getPrerequisiteNodeId)
                .toList();
        return progressionNodeRepository.findAllById(prerequisiteIds);
    }

    @Transactional(readOnly = true)
    public List<ProgressionNode> getDependents(Integer nodeId) {
        List<Integer> dependentIds = progressionPrerequisiteRepository.findByPrerequisiteNodeId(nodeId).stream()
                .map(ProgressionPrerequisite::getNodeId)
                .toList();
        return progressionNodeRepository.findAllById(dependentIds);
    }

    /**
     * Replaces the static prerequisite edges of {@code nodeId}. Rejects the whole edge set when it
     * would close a cycle through the existing graph.
     */
    @Transactional
    public void syncPrerequisites(Integer nodeId, Collection<Integer> prerequisiteIds) {
        Set<Integer> requested = new LinkedHashSet<>(prerequisiteIds);
        if (requested.contains(nodeId)) {
            throw new TreeConfigException(TreeConfigException.Kind.CYCLE_DETECTED,
                    "Node " + nodeId + " cannot require itself");
        }

        Map<Integer, Set<Integer>> edges = new HashMap<>();
        for (ProgressionPrerequisite edge : progressionPrerequisiteRepository.findAll()) {
            if (!edge.getNodeId().equals(nodeId)) {
                edges.computeIfAbsent(edge.getNodeId(), ignored -> new LinkedHashSet<>()).add(edge.getPrerequisiteNodeId());
            }
        }
        edges.put(nodeId, requested);
        if (hasCycleFrom(nodeId, edges, new HashSet<>(), new HashSet<>())) {
            throw new TreeConfigException(TreeConfigException.Kind.CYCLE_DETECTED,
                    "Prerequisites " + requested + " for node " + nodeId + " would create a cycle");
        }

        progressionPrerequisiteRepository.deleteByNodeId(nodeId);
        List<ProgressionPrerequisite> rows = requested.stream()
                .map(prerequisiteId -> new ProgressionPrerequisite(nodeId, prerequisiteId))
                .toList();
        progressionPrerequisiteRepository.saveAll(rows);
    }

    @Transactional(readOnly = true)
    public boolean isNodeUnlocked(String nodeKey, int level) {
        return progressionUnlockRepository.isNodeUnlocked(nodeKey, level);
    }

    @Transactional(readOnly = true)
    public boolean isFeatureUnlocked(String featureKey) {
        return progressionUnlockRepository.isNodeUnlocked(featureKey, 1);
    }

    /**
     * Records the unlock and publishes {@code progression.node_unlocked} once the transaction
     * commits.
     *
     * @return false when (node, level) was already unlocked
     */
    @Transactional
    public boolean unlockNode(Integer nodeId, int level, String unlockedBy, long engagementScore) {
        ProgressionNode node = progressionNodeRepository.findById(nodeId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Node not found: " + nodeId));
        int inserted = progressionUnlockRepository.insertIfAbsent(nodeId, level, unlockedBy, engagementScore);
        if (inserted == 0) {
            log.debug("Node {} level {} already unlocked", node.getNodeKey(), level);
            return false;
        }
        log.info("Unlocked node {} at level {} (source={}, engagementScore={})",
                node.getNodeKey(), level, unlockedBy, engagementScore);
        progressionEventPublisher.publish(ProgressionEvent.nodeUnlocked(nodeId, node.getNodeKey(), level, unlockedBy));
        return true;
    }

    /**
     * Removes {@code level} of the node, or every level when {@code level == 0}. Progress still
     * targeting the node is cleared after commit by {@link #onNodeRelocked(ProgressionEvent)}.
     *
     * @return number of unlock rows removed
     */
    @Transactional
    public int relockNode(Integer nodeId, int level) {
        ProgressionNode node = progressionNodeRepository.findById(nodeId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Node not found: " + nodeId));
        int removed = progressionUnlockRepository.deleteByNodeIdAndLevel(nodeId, level);
        if (removed == 0) {
            log.debug("Relock of node {} level {} removed nothing", node.getNodeKey(), level);
            return 0;
        }
        log.info("Relocked node {} level {} ({} unlock rows removed)", node.getNodeKey(), level, removed);
        progressionEventPublisher.publish(ProgressionEvent.nodeRelocked(nodeId, node.getNodeKey(), level));
        return removed;
    }

    @EventListener
    public void onNodeRelocked(ProgressionEvent event) {
        if (!ProgressionEvent.NODE_RELOCKED.equals(event.type())) {
            return;
        }
        try {
            int cleared = unlockProgressService.clearProgressForNode(event.nodeId());
            if (cleared > 0) {
                log.info("Cleared {} unlock progress rows targeting relocked node {}", cleared, event.nodeKey());
            }
        } catch (RuntimeException ex) {
            log.warn("Failed to clear unlock progress for relocked node {}", event.nodeKey(), ex);
        }
    }

    @Transactional(readOnly = true)
    public long countUnlockedNodesBelowTier(int tier) {
        return progressionUnlockRepository.countUnlockedNodesBelowTier(tier);
    }

    @Transactional(readOnly = true)
    public long countUnlockRows() {
        return progressionUnlockRepository.count();
    }

    @Transactional(readOnly = true)
    public long countTotalUnlockedNodes() {
        return progressionUnlockRepository.countUnlockedNodes();
    }

    @Transactional(readOnly = true)
    public List<DynamicPrerequisite> getNodeDynamicPrerequisites(Integer nodeId) {
        ProgressionNode node = progressionNodeRepository.findById(nodeId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Node not found: " + nodeId));
        return DynamicPrerequisiteJsonCodec.fromJson(node.getDynamicPrerequisites());
    }

    @Transactional
    public void updateNodeDynamicPrerequisites(Integer nodeId, List<DynamicPrerequisite> prerequisites) {
        ProgressionNode node = progressionNodeRepository.findById(nodeId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Node not found: " + nodeId));
        node.setDynamicPrerequisites(DynamicPrerequisiteJsonCodec.toJson(prerequisites));
        node.setUpdatedAt(OffsetDateTime.now());
        progressionNodeRepository.save(node);
    }

    /**
     * Highest unlocked level per node id. Nodes without unlocks are absent.
     */
    @Transactional(readOnly = true)
    public Map<Integer, Integer> getUnlockedLevels() {
        Map<Integer, Integer> levels = new HashMap<>();
        for (NodeLevelRow row : progressionUnlockRepository.findUnlockedLevels()) {
            levels.put(row.getNodeId(), row.getLevel());
        }
        return levels;
    }

    @Transactional(readOnly = true)
    public List<TreeNodeView> getProgressionTree() {
        List<ProgressionNode> nodes = getAllNodes();
        Map<Integer, Integer> unlockedLevels = getUnlockedLevels();
        Map<Integer, List<Integer>> dependentsByNode = new HashMap<>();
        for (ProgressionPrerequisite edge : progressionPrerequisiteRepository.findAll()) {
            dependentsByNode.computeIfAbsent(edge.getPrerequisiteNodeId(), ignored -> new ArrayList<>()).add(edge.getNodeId());
        }

        List<TreeNodeView> tree = new ArrayList<>(nodes.size());
        for (ProgressionNode node : nodes) {
            Integer level = unlockedLevels.get(node.getId());
            List<Integer> dependents = dependentsByNode.getOrDefault(node.getId(), List.of()).stream().sorted().toList();
            tree.add(new TreeNodeView(node, level != null, level == null ? 0 : level, dependents));
        }
        return tree;
    }

    /**
     * Nodes that can be voted on now: below max level, every static prerequisite unlocked and
     * every dynamic prerequisite met.
     */
    @Transactional(readOnly = true)
    public List<ProgressionNode> getAvailableUnlocks() {
        GraphSnapshot snapshot = snapshot();
        List<ProgressionNode> available = new ArrayList<>();
        for (ProgressionNode node : snapshot.nodes()) {
            if (snapshot.isAvailable(node)) {
                available.add(node);
            }
        }
        return available;
    }

    /**
     * {@link #getAvailableUnlocks()} plus the locked dependents of the current unlock target, so
     * the next ballot can offer nodes that open up once the target unlocks.
     */
    @Transactional(readOnly = true)
    public List<ProgressionNode> getAvailableUnlocksWithFutureTarget() {
        List<ProgressionNode> available = getAvailableUnlocks();
        Optional<UnlockProgress> progress = unlockProgressService.getActiveUnlockProgress();
        if (progress.isEmpty() || progress.get().getNodeId() == null) {
            return available;
        }

        Integer targetNodeId = progress.get().getNodeId();
        GraphSnapshot snapshot = snapshot();
        Map<Integer, ProgressionNode> combined = new LinkedHashMap<>();
        available.forEach(node -> combined.put(node.getId(), node));
        for (ProgressionNode node : snapshot.nodes()) {
            if (snapshot.isMaxed(node)) {
                continue;
            }
            if (snapshot.prerequisitesOf(node.getId()).contains(targetNodeId)) {
                combined.putIfAbsent(node.getId(), node);
            }
        }
        log.debug("Available unlocks: {} now, {} including dependents of target node {}",
                available.size(), combined.size(), targetNodeId);
        return new ArrayList<>(combined.values());
    }

    /**
     * Locked static prerequisites of {@code nodeKey}, transitively, in discovery order.
     */
    @Transactional(readOnly = true)
    public List<ProgressionNode> getRequiredNodes(String nodeKey) {
        ProgressionNode target = requireNodeByKey(nodeKey);
        GraphSnapshot snapshot = snapshot();
        List<ProgressionNode> locked = new ArrayList<>();
        collectLockedPrerequisites(target.getId(), snapshot, new HashSet<>(), locked);
        return locked;
    }

    /**
     * Level 1 for a locked node, otherwise the level after the highest unlocked one.
     */
    @Transactional(readOnly = true)
    public int calculateNextTargetLevel(ProgressionNode node) {
        Integer unlocked = progressionUnlockRepository.findMaxLevelByNodeId(node.getId());
        if (unlocked == null || unlocked < 1 || unlocked >= node.getMaxLevel()) {
            return 1;
        }
        return unlocked + 1;
    }

    @Transactional(readOnly = true)
    public boolean allNodesAtMaxLevel() {
        GraphSnapshot snapshot = snapshot();
        return !snapshot.nodes().isEmpty() && snapshot.nodes().stream().allMatch(snapshot::isMaxed);
    }

    private void collectLockedPrerequisites(Integer nodeId, GraphSnapshot snapshot, Set<Integer> visited,
                                            List<ProgressionNode> locked) {
        if (!visited.add(nodeId)) {
            return;
        }
        for (Integer prerequisiteId : snapshot.prerequisitesOf(nodeId)) {
            ProgressionNode prerequisite = snapshot.nodesById().get(prerequisiteId);
            if (prerequisite == null || snapshot.unlockedLevels().containsKey(prerequisiteId)) {
                continue;
            }
            if (locked.stream().noneMatch(existing -> existing.getId().equals(prerequisiteId))) {
                locked.add(prerequisite);
            }
            collectLockedPrerequisites(prerequisiteId, snapshot, visited, locked);
        }
    }

    private static boolean hasCycleFrom(Integer nodeId, Map<Integer, Set<Integer>> edges, Set<Integer> visiting,
                                        Set<Integer> done) {
        if (done.contains(nodeId)) {
            return false;
        }
        if (!visiting.add(nodeId)) {
            return true;
        }
        for (Integer next : edges.getOrDefault(nodeId, Set.of())) {
            if (hasCycleFrom(next, edges, visiting, done)) {
                return true;
            }
        }
        visiting.remove(nodeId);
        done.add(nodeId);
        return false;
    }

    private GraphSnapshot snapshot() {
        List<ProgressionNode> nodes = getAllNodes();
        Map<Integer, ProgressionNode> nodesById = new HashMap<>();
        nodes.forEach(node -> nodesById.put(node.getId(), node));
        Map<Integer, List<Integer>> prerequisites = new HashMap<>();
        for (ProgressionPrerequisite edge : progressionPrerequisiteRepository.findAll()) {
            prerequisites.computeIfAbsent(edge.getNodeId(), ignored -> new ArrayList<>()).add(edge.getPrerequisiteNodeId());
        }
        return new GraphSnapshot(nodes, nodesById, prerequisites, getUnlockedLevels(),
                progressionUnlockRepository::countUnlockedNodesBelowTier, countTotalUnlockedNodes());
    }

    public record TreeNodeView(
            ProgressionNode node,
            boolean unlocked,
            int unlockedLevel,
            List<Integer> dependentIds
    ) {
    }

    private record GraphSnapshot(
            List<ProgressionNode> nodes,
            Map<Integer, ProgressionNode> nodesById,
            Map<Integer, List<Integer>> prerequisites,
            Map<Integer, Integer> unlockedLevels,
            TierCounter belowTierCounter,
            long totalUnlocked
    ) {
        List<Integer> prerequisitesOf(Integer nodeId) {
            return prerequisites.getOrDefault(nodeId, List.of());
        }

        boolean isMaxed(ProgressionNode node) {
            Integer level = unlockedLevels.get(node.getId());
            return level != null && level >= node.getMaxLevel();
        }

        boolean isAvailable(ProgressionNode node) {
            if (isMaxed(node)) {
                return false;
            }
            for (Integer prerequisiteId : prerequisitesOf(node.getId())) {
                if (!unlockedLevels.containsKey(prerequisiteId)) {
                    return false;
                }
            }
            return dynamicPrerequisitesMet(node);
        }

        private boolean dynamicPrerequisitesMet(ProgressionNode node) {
            List<DynamicPrerequisite> dynamicPrerequisites;
            try {
                dynamicPrerequisites = DynamicPrerequisiteJsonCodec.fromJson(node.getDynamicPrerequisites());
            } catch (IllegalArgumentException ex) {
                log.warn("Unreadable dynamic prerequisites on node {}, treating as unavailable", node.getNodeKey(), ex);
                return false;
            }
            for (DynamicPrerequisite prerequisite : dynamicPrerequisites) {
                long count = switch (prerequisite.type()) {
                    case NODES_UNLOCKED_BELOW_TIER -> belowTierCounter.count(prerequisite.tier());
                    case TOTAL_NODES_UNLOCKED -> totalUnlocked;
                };
                if (count < prerequisite.count()) {
                    return false;
                }
            }
            return true;
        }
    }

    @FunctionalInterface
    private interface TierCounter {
        long count(int tier);
    }
}
