package com.brandish.progression.mapper;

import com.brandish.progression.dto.ProgressionResponses;
import com.brandish.progression.model.EngagementMetric;
import com.brandish.progression.model.ProgressionNode;
import com.brandish.progression.model.ProgressionReset;
import com.brandish.progression.model.UnlockProgress;
import com.brandish.progression.model.UserProgression;
import com.brandish.progression.model.VotingOption;
import com.brandish.progression.service.ProgressionService;
import com.brandish.progression.service.UnlockGraphService;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

@Component
public class ProgressionResponseMapper {

    public ProgressionResponses.Node toNodeResponse(ProgressionNode node) {
        return new ProgressionResponses.Node(
                node.getId(),
                node.getNodeKey(),
                node.getNodeType(),
                node.getDisplayName(),
                node.getDescription(),
                node.getMaxLevel(),
                node.getUnlockCost(),
                node.getTier(),
                node.getSize(),
                node.getCategory(),
                node.getSortOrder(),
                node.getModifierConfig(),
                node.getDynamicPrerequisites()
        );
    }

    public List<ProgressionResponses.Node> toNodeResponses(Collection<ProgressionNode> nodes) {
        return nodes.stream().map(this::toNodeResponse).toList();
    }

    public List<ProgressionResponses.TreeNode> toTreeResponses(Collection<UnlockGraphService.TreeNodeView> views) {
        return views.stream()
                .map(view -> new ProgressionResponses.TreeNode(
                        toNodeResponse(view.node()),
                        view.unlocked(),
                        view.unlockedLevel(),
                        view.dependentIds()
                ))
                .toList();
    }

    /**
     * @param nodesById used to label options; an option whose node is gone keeps null labels
     */
    public ProgressionResponses.VotingSession toSessionResponse(
            ProgressionService.SessionWithOptions sessionWithOptions,
            Map<Integer, ProgressionNode> nodesById
    ) {
        if (sessionWithOptions == null) {
            return null;
        }
        List<ProgressionResponses.VotingOption> options = new ArrayList<>();
        List<VotingOption> sessionOptions = sessionWithOptions.options();
        for (int i = 0; i < sessionOptions.size(); i++) {
            options.add(toOptionResponse(i + 1, sessionOptions.get(i), nodesById.get(sessionOptions.get(i).getNodeId())));
        }
        var session = sessionWithOptions.session();
        return new ProgressionResponses.VotingSession(
                session.getId(),
                session.getStatus(),
                session.getStartedAt(),
                session.getVotingDeadline(),
                session.getEndedAt(),
                session.getWinningOptionId(),
                options
        );
    }

    public ProgressionResponses.VotingOption toOptionResponse(int optionIndex, VotingOption option, ProgressionNode node) {
        return new ProgressionResponses.VotingOption(
                optionIndex,
                option.getId(),
                option.getNodeId(),
                node != null ? node.getNodeKey() : null,
                node != null ? node.getDisplayName() : null,
                option.getTargetLevel(),
                option.getVoteCount(),
                option.getLastHighestVoteAt()
        );
    }

    public ProgressionResponses.UnlockProgress toUnlockProgressResponse(UnlockProgress progress) {
        if (progress == null) {
            return null;
        }
        return new ProgressionResponses.UnlockProgress(
                progress.getId(),
                progress.getNodeId(),
                progress.getTargetLevel(),
                progress.getVotingSessionId(),
                progress.getContributionsAccumulated(),
                progress.getStartedAt(),
                progress.getUnlockedAt()
        );
    }

    public ProgressionResponses.ProgressionStatus toStatusResponse(
            ProgressionService.ProgressionStatus status,
            Map<Integer, ProgressionNode> nodesById
    ) {
        return new ProgressionResponses.ProgressionStatus(
                status.totalUnlocked(),
                status.totalNodes(),
                status.allNodesUnlocked(),
                status.contributionScore(),
                toSessionResponse(status.activeSession(), nodesById),
                toUnlockProgressResponse(status.activeUnlockProgress()),
                status.estimatedUnlockAt(),
                status.transitioning()
        );
    }

    public ProgressionResponses.UnlockOutcome toUnlockOutcomeResponse(ProgressionService.UnlockOutcome outcome) {
        return new ProgressionResponses.UnlockOutcome(
                outcome.node().getNodeKey(),
                outcome.level(),
                outcome.source(),
                outcome.engagementScore(),
                outcome.rollover()
        );
    }

    public ProgressionResponses.EngagementMetric toMetricResponse(EngagementMetric metric) {
        return new ProgressionResponses.EngagementMetric(
                metric.getId(),
                metric.getUserId(),
                metric.getMetricType(),
                metric.getMetricValue(),
                metric.getRecordedAt()
        );
    }

    public List<ProgressionResponses.UserProgression> toUserProgressionResponses(Collection<UserProgression> progressions) {
        return progressions.stream()
                .map(progression -> new ProgressionResponses.UserProgression(
                        progression.getUserId(),
                        progression.getProgressionType(),
                        progression.getProgressionKey(),
                        progression.getUnlockedAt(),
                        progression.getMetadata()
                ))
                .toList();
    }

    public ProgressionResponses.Reset toResetResponse(ProgressionReset reset) {
        return new ProgressionResponses.Reset(
                reset.getId(),
                reset.getResetAt(),
                reset.getResetBy(),
                reset.getReason(),
                reset.getNodesResetCount(),
                reset.getEngagementScoreAtReset()
        );
    }
}
