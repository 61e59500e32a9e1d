package com.brandish.progression.service;

import com.brandish.progression.model.ProgressionNode;
import com.brandish.progression.model.ProgressionReset;
import com.brandish.progression.tree.ProgressionTreeLoader;
import com.brandish.progression.tree.TreeSyncResult;
import com.brandish.progression.web.ProgressionConflictException;
import com.brandish.progression.web.ProgressionValidationException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Operator overrides on the shared tree.
 */
@Service
@RequiredArgsConstructor
public class ProgressionAdminService {

    public static final String SOURCE_ADMIN = "admin";

    private static final Logger log = LoggerFactory.getLogger(ProgressionAdminService.class);

    private final UnlockGraphService unlockGraphService;
    private final EngagementLedgerService engagementLedgerService;
    private final EngagementWeightService engagementWeightService;
    private final ModifierService modifierService;
    private final ProgressionResetService progressionResetService;
    private final ProgressionService progressionService;
    private final ProgressionTreeLoader progressionTreeLoader;

    /**
     * @return false when the level was already unlocked
     */
    public boolean adminUnlock(String nodeKey, int level) {
        if (level < 1) {
            throw new ProgressionValidationException("level must be >= 1, got " + level);
        }
        ProgressionNode node = unlockGraphService.requireNodeByKey(nodeKey);
        if (level > node.getMaxLevel()) {
            throw ProgressionConflictException.maxLevelExceeded(
                    "Level " + level + " exceeds max level " + node.getMaxLevel() + " for node " + nodeKey);
        }
        long engagementScore = engagementLedgerService.getEngagementScore(null);
        boolean unlocked = unlockGraphService.unlockNode(node.getId(), level, SOURCE_ADMIN, engagementScore);
        log.info("Admin unlocked node {} level {} (new={})", nodeKey, level, unlocked);
        return unlocked;
    }

    /**
     * Unlocks every node at its max level. A node that fails is logged and skipped.
     *
     * @return number of nodes newly unlocked
     */
    public int adminUnlockAll() {
        int unlocked = 0;
        for (ProgressionNode node : unlockGraphService.getAllNodes()) {
            try {
                if (adminUnlock(node.getNodeKey(), node.getMaxLevel())) {
                    unlocked++;
                }
            } catch (RuntimeException ex) {
                log.warn("Admin unlock-all failed for node {}", node.getNodeKey(), ex);
            }
        }
        log.info("Admin unlocked all nodes ({} newly unlocked)", unlocked);
        return unlocked;
    }

    /**
     * @param level level to remove, or 0 for every level
     * @return number of unlock rows removed
     */
    public int adminRelock(String nodeKey, int level) {
        if (level < 0) {
            throw new ProgressionValidationException("level must be >= 0, got " + level);
        }
        ProgressionNode node = unlockGraphService.requireNodeByKey(nodeKey);
        int removed = unlockGraphService.relockNode(node.getId(), level);
        log.info("Admin relocked node {} level {} ({} rows removed)", nodeKey, level, removed);
        return removed;
    }

    /**
     * Resets the tree, then re-seeds a target and ballot from what the root opens up.
     */
    public ProgressionReset resetTree(String resetBy, String reason, boolean preserveUserData) {
        ProgressionReset reset = progressionResetService.resetTree(resetBy, reason, preserveUserData);
        modifierService.invalidateAll();
        try {
            progressionService.initializeProgressionState();
        } catch (RuntimeException ex) {
            log.warn("Progression state was not re-initialized after reset {}", reset.getId(), ex);
        }
        return reset;
    }

    public void invalidateWeightCache() {
        engagementWeightService.invalidate();
    }

    /**
     * Re-reads the tree config and syncs it even when the file hash is unchanged.
     */
    public TreeSyncResult syncTree() {
        TreeSyncResult result = progressionTreeLoader.sync(true);
        if (result.inserted() > 0 || result.autoUnlocked() > 0) {
            try {
                progressionService.initializeProgressionState();
            } catch (RuntimeException ex) {
                log.warn("Progression state was not re-initialized after tree sync", ex);
            }
        }
        return result;
    }
}
