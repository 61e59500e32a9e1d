package com.brandish.progression.repository;

import com.brandish.progression.model.EngagementMetric;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;

@Repository
public interface EngagementMetricRepository extends JpaRepository<EngagementMetric, Long> {

    @Query("""
            select m.metricType as metricType, sum(m.metricValue) as total
            from EngagementMetric m
            group by m.metricType
            """)
    List<MetricTypeTotalRow> sumByMetricType();

    @Query("""
            select m.metricType as metricType, sum(m.metricValue) as total
            from EngagementMetric m
            where m.recordedAt >= :since
            group by m.metricType
            """)
    List<MetricTypeTotalRow> sumByMetricTypeSince(@Param("since") OffsetDateTime since);

    @Query("""
            select m.metricType as metricType, sum(m.metricValue) as total
            from EngagementMetric m
            where m.userId = :userId
            group by m.metricType
            """)
    List<MetricTypeTotalRow> sumByMetricTypeForUser(@Param("userId") String userId);

    @Query(value = """
            SELECT
                TO_CHAR(metric.recorded_at AT TIME ZONE 'UTC', 'YYYY-MM-DD') AS day,
                metric.metric_type AS metricType,
                SUM(metric.metric_value) AS total
            FROM engagement_metrics metric
            WHERE metric.recorded_at >= :since
            GROUP BY TO_CHAR(metric.recorded_at AT TIME ZONE 'UTC', 'YYYY-MM-DD'), metric.metric_type
            ORDER BY day ASC, metricType ASC
            """, nativeQuery = true)
    List<DailyMetricTotalRow> sumByDayAndMetricTypeSince(@Param("since") OffsetDateTime since);

    @Query(value = """
            WITH user_contributions AS (
                SELECT user_id, SUM(metric_value) AS total_contribution
                FROM engagement_metrics
                GROUP BY user_id
            )
            SELECT
                user_id AS userId,
                total_contribution AS totalContribution,
                ROW_NUMBER() OVER (ORDER BY total_contribution DESC, user_id ASC) AS rank
            FROM user_contributions
            ORDER BY total_contribution DESC, user_id ASC
            LIMIT :limit
            """, nativeQuery = true)
    List<ContributionLeaderboardRow> findContributionLeaderboard(@Param("limit") int limit);

    @Query("select coalesce(sum(m.metricValue), 0) from EngagementMetric m")
    long sumAllMetricValues();
}
