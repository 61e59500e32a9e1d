package com.brandish.progression.service;

import com.brandish.progression.config.ProgressionProperties;
import com.brandish.progression.model.EngagementMetric;
import com.brandish.progression.repository.ContributionLeaderboardRow;
import com.brandish.progression.repository.DailyMetricTotalRow;
import com.brandish.progression.repository.EngagementMetricRepository;
import com.brandish.progression.repository.MetricTypeTotalRow;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Append-only engagement log and the weighted scores derived from it. Weighted values are
 * truncated per metric type, never per event. Metric types without a weight add nothing to
 * a score.
 */
@Service
@RequiredArgsConstructor
public class EngagementLedgerService {

    public static final String METRIC_MESSAGE = "message";
    public static final String METRIC_COMMAND = "command";
    public static final String METRIC_ITEM_CRAFTED = "item_crafted";
    public static final String METRIC_ITEM_USED = "item_used";
    public static final String METRIC_VOTE_CAST = "vote_cast";

    private final EngagementMetricRepository engagementMetricRepository;
    private final EngagementWeightService engagementWeightService;
    private final ProgressionProperties progressionProperties;

    @Transactional
    public EngagementMetric recordEngagement(String userId, String metricType, int value, JsonNode metadata) {
        EngagementMetric metric = new EngagementMetric();
        metric.setUserId(Objects.requireNonNull(userId, "userId is required"));
        metric.setMetricType(Objects.requireNonNull(metricType, "metricType is required"));
        metric.setMetricValue(value);
        metric.setRecordedAt(OffsetDateTime.now());
        metric.setMetadata(metadata);
        return engagementMetricRepository.save(metric);
    }

    /**
     * @param since only count metrics recorded at or after this instant; {@code null} for all time
     */
    @Transactional(readOnly = true)
    public long getEngagementScore(OffsetDateTime since) {
        List<MetricTypeTotalRow> rows = since == null
                ? engagementMetricRepository.sumByMetricType()
                : engagementMetricRepository.sumByMetricTypeSince(since);
        return weightedTotal(rows);
    }

    @Transactional(readOnly = true)
    public UserEngagementBreakdown getUserEngagement(String userId) {
        long messages = 0;
        long commands = 0;
        long itemsCrafted = 0;
        long itemsUsed = 0;
        List<MetricTypeTotalRow> rows = engagementMetricRepository.sumByMetricTypeForUser(userId);
        for (MetricTypeTotalRow row : rows) {
            long total = row.getTotal() == null ? 0L : row.getTotal();
            switch (row.getMetricType()) {
                case METRIC_MESSAGE -> messages = total;
                case METRIC_COMMAND -> commands = total;
                case METRIC_ITEM_CRAFTED -> itemsCrafted = total;
                case METRIC_ITEM_USED -> itemsUsed = total;
                default -> {
                    // counted in the weighted total only
                }
            }
        }
        return new UserEngagementBreakdown(userId, messages, commands, itemsCrafted, itemsUsed, weightedTotal(rows));
    }

    public Map<String, Double> getEngagementWeights() {
        return engagementWeightService.getWeights();
    }

    /**
     * Weighted score per calendar day since {@code since}, oldest first. Days without activity
     * are absent.
     */
    @Transactional(readOnly = true)
    public List<DailyEngagementTotal> getDailyEngagementTotals(OffsetDateTime since) {
        Map<String, Double> weights = engagementWeightService.getWeights();
        Map<LocalDate, Double> totalsByDay = new LinkedHashMap<>();
        for (DailyMetricTotalRow row : engagementMetricRepository.sumByDayAndMetricTypeSince(since)) {
            double weight = weights.getOrDefault(row.getMetricType(), EngagementWeightService.UNWEIGHTED_METRIC_WEIGHT);
            long total = row.getTotal() == null ? 0L : row.getTotal();
            totalsByDay.merge(LocalDate.parse(row.getDay()), total * weight, Double::sum);
        }
        List<DailyEngagementTotal> totals = new ArrayList<>(totalsByDay.size());
        totalsByDay.forEach((day, points) -> totals.add(new DailyEngagementTotal(day, (long) points.doubleValue())));
        return totals;
    }

    @Transactional(readOnly = true)
    public List<LeaderboardEntry> getContributionLeaderboard(int limit) {
        ProgressionProperties.Engagement engagement = progressionProperties.getEngagement();
        int effectiveLimit = limit <= 0 || limit > engagement.getLeaderboardMaxLimit()
                ? engagement.getLeaderboardDefaultLimit()
                : limit;
        List<ContributionLeaderboardRow> rows = engagementMetricRepository.findContributionLeaderboard(effectiveLimit);
        return rows.stream()
                .map(row -> new LeaderboardEntry(
                        row.getRank() == null ? 0 : row.getRank().intValue(),
                        row.getUserId(),
                        row.getTotalContribution() == null ? 0L : row.getTotalContribution()
                ))
                .toList();
    }

    @Transactional(readOnly = true)
    public long getTotalRawEngagement() {
        return engagementMetricRepository.sumAllMetricValues();
    }

    private long weightedTotal(List<MetricTypeTotalRow> rows) {
        Map<String, Double> weights = engagementWeightService.getWeights();
        long score = 0;
        for (MetricTypeTotalRow row : rows) {
            long total = row.getTotal() == null ? 0L : row.getTotal();
            double weight = weights.getOrDefault(row.getMetricType(), EngagementWeightService.UNWEIGHTED_METRIC_WEIGHT);
            score += (long) (total * weight);
        }
        return score;
    }

    public record UserEngagementBreakdown(
            String userId,
            long messagesSent,
            long commandsUsed,
            long itemsCrafted,
            long itemsUsed,
            long totalScore
    ) {
    }

    public record DailyEngagementTotal(
            LocalDate day,
            long points
    ) {
    }

    public record LeaderboardEntry(
            int rank,
            String userId,
            long contribution
    ) {
    }
}
