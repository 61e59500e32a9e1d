package com.brandish.progression.model;

/**
 * Threshold rule evaluated against live unlock counts. {@code tier} only applies to
 * {@link DynamicPrerequisiteType#NODES_UNLOCKED_BELOW_TIER}.
 */
public record DynamicPrerequisite(
        DynamicPrerequisiteType type,
        int tier,
        int count
) {
    public static DynamicPrerequisite nodesUnlockedBelowTier(int tier, int count) {
        return new DynamicPrerequisite(DynamicPrerequisiteType.NODES_UNLOCKED_BELOW_TIER, tier, count);
    }

    public static DynamicPrerequisite totalNodesUnlocked(int count) {
        return new DynamicPrerequisite(DynamicPrerequisiteType.TOTAL_NODES_UNLOCKED, 0, count);
    }
}
