package com.brandish.progression.service;

import com.brandish.progression.config.ProgressionProperties;
import com.brandish.progression.model.EngagementMetric;
import com.brandish.progression.model.ProgressionNode;
import com.brandish.progression.model.UnlockProgress;
import com.brandish.progression.web.ProgressionValidationException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Turns engagement into unlock contributions: weight, progression-rate modifiers, the community
 * boost, and the unlock check once the target is funded.
 */
@Service
@RequiredArgsConstructor
public class ContributionService {

    static final int MAX_CONTRIBUTION_ATTEMPTS = 3;

    private static final Logger log = LoggerFactory.getLogger(ContributionService.class);

    private final EngagementLedgerService engagementLedgerService;
    private final EngagementWeightService engagementWeightService;
    private final ModifierService modifierService;
    private final UnlockGraphService unlockGraphService;
    private final UnlockProgressService unlockProgressService;
    private final ProgressionService progressionService;
    private final ProgressionProperties progressionProperties;

    /**
     * Appends the metric, then adds its weighted score to the active cycle. The append is the
     * only part that can fail the call.
     */
    public EngagementMetric recordEngagement(String userId, String metricType, int value, JsonNode metadata) {
        if (userId == null || userId.isBlank()) {
            throw new ProgressionValidationException("userId is required");
        }
        if (metricType == null || metricType.isBlank()) {
            throw new ProgressionValidationException("metricType is required");
        }
        if (value < 0) {
            throw new ProgressionValidationException("value must be >= 0, got " + value);
        }

        EngagementMetric metric = engagementLedgerService.recordEngagement(userId, metricType, value, metadata);
        int score = contributionScore(metricType, value);
        if (score > 0) {
            try {
                addContribution(score);
            } catch (RuntimeException ex) {
                log.warn("Failed to add contribution of {} from {} engagement by {}", score, metricType, userId, ex);
            }
        }
        return metric;
    }

    /**
     * value x weight, passed through the {@code progression_rate} modifiers and truncated.
     */
    public int contributionScore(String metricType, int value) {
        double baseScore = value * engagementWeightService.weightFor(metricType);
        double modifiedScore = baseScore;
        try {
            modifiedScore = modifierService.getModifiedValue(
                    progressionProperties.getUnlock().getProgressionRateFeatureKey(), baseScore);
        } catch (RuntimeException ex) {
            log.warn("Failed to apply progression rate modifiers, using base score {}", baseScore, ex);
        }
        return (int) modifiedScore;
    }

    /**
     * Adds {@code amount} (boosted when the contribution boost is unlocked) to the active cycle,
     * retrying on the successor if the cycle completes underneath.
     *
     * @return the amount actually credited
     */
    public int addContribution(int amount) {
        if (amount <= 0) {
            return 0;
        }
        int boosted = applyContributionBoost(amount);

        UnlockProgress credited = null;
        for (int attempt = 1; attempt <= MAX_CONTRIBUTION_ATTEMPTS && credited == null; attempt++) {
            UnlockProgress progress = unlockProgressService.ensureActiveUnlockProgress();
            if (unlockProgressService.addContribution(progress.getId(), boosted)) {
                credited = progress;
            } else {
                log.debug("Unlock progress {} completed before contribution landed (attempt {})", progress.getId(), attempt);
            }
        }
        if (credited == null) {
            throw new IllegalStateException("Could not credit contribution of " + boosted + " after "
                    + MAX_CONTRIBUTION_ATTEMPTS + " attempts");
        }

        Optional<UnlockProgress> current = unlockProgressService.getActiveUnlockProgress();
        if (current.isPresent() && current.get().hasTarget()) {
            UnlockProgress progress = current.get();
            Optional<ProgressionNode> target = unlockGraphService.getNodeById(progress.getNodeId());
            if (target.isPresent() && progress.getContributionsAccumulated() >= target.get().getUnlockCost()) {
                log.info("Unlock threshold met for {}: {}/{}", target.get().getNodeKey(),
                        progress.getContributionsAccumulated(), target.get().getUnlockCost());
                progressionService.checkAndUnlockNode();
            }
        }
        return boosted;
    }

    private int applyContributionBoost(int amount) {
        ProgressionProperties.Unlock unlock = progressionProperties.getUnlock();
        if (!unlockGraphService.isFeatureUnlocked(unlock.getContributionBoostKey())) {
            return amount;
        }
        return amount * unlock.getContributionBoostNumerator() / unlock.getContributionBoostDenominator();
    }
}
