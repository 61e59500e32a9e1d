package com.brandish.progression.dto;

import com.brandish.progression.model.NodeSize;
import com.brandish.progression.model.ProgressionNodeType;
import com.brandish.progression.model.VotingSessionStatus;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.OffsetDateTime;
import java.util.List;

public final class ProgressionResponses {

    private ProgressionResponses() {
    }

    public record Node(
            Integer id,
            String nodeKey,
            ProgressionNodeType nodeType,
            String displayName,
            String description,
            Integer maxLevel,
            Integer unlockCost,
            Integer tier,
            NodeSize size,
            String category,
            Integer sortOrder,
            JsonNode modifierConfig,
            JsonNode dynamicPrerequisites
    ) {
    }

    public record TreeNode(
            Node node,
            boolean unlocked,
            int unlockedLevel,
            List<Integer> dependentIds
    ) {
    }

    /**
     * {@code optionIndex} is the 1-based index voters pass back.
     */
    public record VotingOption(
            int optionIndex,
            Integer optionId,
            Integer nodeId,
            String nodeKey,
            String displayName,
            Integer targetLevel,
            Integer voteCount,
            OffsetDateTime lastHighestVoteAt
    ) {
    }

    public record VotingSession(
            Integer sessionId,
            VotingSessionStatus status,
            OffsetDateTime startedAt,
            OffsetDateTime votingDeadline,
            OffsetDateTime endedAt,
            Integer winningOptionId,
            List<VotingOption> options
    ) {
    }

    public record UnlockProgress(
            Integer id,
            Integer nodeId,
            Integer targetLevel,
            Integer votingSessionId,
            Integer contributionsAccumulated,
            OffsetDateTime startedAt,
            OffsetDateTime unlockedAt
    ) {
    }

    public record ProgressionStatus(
            long totalUnlocked,
            int totalNodes,
            boolean allNodesUnlocked,
            long contributionScore,
            VotingSession activeSession,
            UnlockProgress activeUnlockProgress,
            OffsetDateTime estimatedUnlockAt,
            boolean transitioning
    ) {
    }

    public record UnlockOutcome(
            String nodeKey,
            int level,
            String source,
            long engagementScore,
            int rollover
    ) {
    }

    public record FeatureUnlocked(
            String featureKey,
            boolean unlocked
    ) {
    }

    public record ModifiedValue(
            String featureKey,
            double baseValue,
            double modifiedValue
    ) {
    }

    public record EngagementMetric(
            Long id,
            String userId,
            String metricType,
            Integer metricValue,
            OffsetDateTime recordedAt
    ) {
    }

    public record UserProgression(
            String userId,
            String progressionType,
            String progressionKey,
            OffsetDateTime unlockedAt,
            JsonNode metadata
    ) {
    }

    public record UserProgressionUnlock(
            String userId,
            String progressionType,
            String progressionKey,
            boolean newlyUnlocked
    ) {
    }

    public record AdminUnlock(
            String nodeKey,
            int level,
            boolean newlyUnlocked
    ) {
    }

    public record AdminRelock(
            String nodeKey,
            int level,
            int unlocksRemoved
    ) {
    }

    public record AdminUnlockAll(
            int nodesUnlocked
    ) {
    }

    public record Reset(
            Integer id,
            OffsetDateTime resetAt,
            String resetBy,
            String reason,
            Integer nodesResetCount,
            Long engagementScoreAtReset
    ) {
    }
}
