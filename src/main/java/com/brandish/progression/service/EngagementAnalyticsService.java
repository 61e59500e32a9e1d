package com.brandish.progression.service;

import com.brandish.progression.model.ProgressionNode;
import com.brandish.progression.model.UnlockProgress;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;

@Service
@RequiredArgsConstructor
public class EngagementAnalyticsService {

    public static final String TREND_STABLE = "stable";
    public static final String TREND_INCREASING = "increasing";
    public static final String TREND_DECREASING = "decreasing";

    public static final String CONFIDENCE_HIGH = "high";
    public static final String CONFIDENCE_MEDIUM = "medium";
    public static final String CONFIDENCE_LOW = "low";

    static final int DEFAULT_VELOCITY_DAYS = 7;
    private static final double TREND_THRESHOLD = 0.1;

    private final EngagementLedgerService engagementLedgerService;
    private final UnlockGraphService unlockGraphService;
    private final UnlockProgressService unlockProgressService;

    /**
     * Weighted points per day over the last {@code days} days. The trend compares the average
     * of the later half of the active days against the earlier half.
     */
    @Transactional(readOnly = true)
    public VelocityMetrics getEngagementVelocity(int days) {
        int periodDays = days <= 0 ? DEFAULT_VELOCITY_DAYS : days;
        List<EngagementLedgerService.DailyEngagementTotal> totals =
                engagementLedgerService.getDailyEngagementTotals(OffsetDateTime.now().minusDays(periodDays));
        if (totals.isEmpty()) {
            return new VelocityMetrics(0.0, TREND_STABLE, periodDays, 0, 0L);
        }

        long totalPoints = totals.stream().mapToLong(EngagementLedgerService.DailyEngagementTotal::points).sum();
        int sampleSize = totals.size();
        return new VelocityMetrics(
                (double) totalPoints / periodDays,
                trendOf(totals),
                periodDays,
                sampleSize,
                totalPoints
        );
    }

    @Transactional(readOnly = true)
    public UnlockEstimate estimateUnlockTime(String nodeKey) {
        ProgressionNode node = unlockGraphService.getNodeByKey(nodeKey)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Node not found: " + nodeKey));
        VelocityMetrics velocity = getEngagementVelocity(DEFAULT_VELOCITY_DAYS);

        if (unlockGraphService.isNodeUnlocked(nodeKey, node.getMaxLevel())) {
            return new UnlockEstimate(nodeKey, 0.0, CONFIDENCE_HIGH, 0, node.getUnlockCost(),
                    velocity.pointsPerDay(), OffsetDateTime.now());
        }

        int currentProgress = unlockProgressService.getActiveUnlockProgress()
                .filter(progress -> Objects.equals(progress.getNodeId(), node.getId()))
                .map(UnlockProgress::getContributionsAccumulated)
                .orElse(0);
        int required = Math.max(0, node.getUnlockCost() - currentProgress);

        double estimatedDays = -1.0;
        OffsetDateTime estimatedUnlockAt = null;
        if (velocity.pointsPerDay() > 0) {
            estimatedDays = required / velocity.pointsPerDay();
            estimatedUnlockAt = OffsetDateTime.now().plusSeconds(Math.round(estimatedDays * 86_400));
        }

        return new UnlockEstimate(nodeKey, estimatedDays, confidenceOf(velocity), required, currentProgress,
                velocity.pointsPerDay(), estimatedUnlockAt);
    }

    static String trendOf(List<EngagementLedgerService.DailyEngagementTotal> totals) {
        int sampleSize = totals.size();
        if (sampleSize < 2) {
            return TREND_STABLE;
        }
        int half = sampleSize / 2;
        long firstHalf = 0;
        long secondHalf = 0;
        for (int i = 0; i < sampleSize; i++) {
            if (i < half) {
                firstHalf += totals.get(i).points();
            } else {
                secondHalf += totals.get(i).points();
            }
        }
        double firstAvg = (double) firstHalf / half;
        double secondAvg = (double) secondHalf / (sampleSize - half);
        if (secondAvg > firstAvg * (1 + TREND_THRESHOLD)) {
            return TREND_INCREASING;
        }
        if (secondAvg < firstAvg * (1 - TREND_THRESHOLD)) {
            return TREND_DECREASING;
        }
        return TREND_STABLE;
    }

    static String confidenceOf(VelocityMetrics velocity) {
        if (velocity.sampleSize() >= 7) {
            return TREND_DECREASING.equals(velocity.trend()) ? CONFIDENCE_MEDIUM : CONFIDENCE_HIGH;
        }
        return velocity.sampleSize() >= 3 ? CONFIDENCE_MEDIUM : CONFIDENCE_LOW;
    }

    public record VelocityMetrics(
            double pointsPerDay,
            String trend,
            int periodDays,
            int sampleSize,
            long totalPoints
    ) {
    }

    public record UnlockEstimate(
            String nodeKey,
            double estimatedDays,
            String confidence,
            int requiredPoints,
            int currentProgress,
            double currentVelocity,
            OffsetDateTime estimatedUnlockAt
    ) {
    }
}
