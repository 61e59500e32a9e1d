package com.brandish.progression.controller;

import com.brandish.progression.dto.ProgressionRequests;
import com.brandish.progression.dto.ProgressionResponses;
import com.brandish.progression.mapper.ProgressionResponseMapper;
import com.brandish.progression.model.EngagementMetric;
import com.brandish.progression.service.ContributionService;
import com.brandish.progression.service.EngagementAnalyticsService;
import com.brandish.progression.service.EngagementLedgerService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/progression/engagement")
public class EngagementController {

    private final ContributionService contributionService;
    private final EngagementLedgerService engagementLedgerService;
    private final EngagementAnalyticsService engagementAnalyticsService;
    private final ProgressionResponseMapper progressionResponseMapper;

    public EngagementController(
            ContributionService contributionService,
            EngagementLedgerService engagementLedgerService,
            EngagementAnalyticsService engagementAnalyticsService,
            ProgressionResponseMapper progressionResponseMapper
    ) {
        this.contributionService = contributionService;
        this.engagementLedgerService = engagementLedgerService;
        this.engagementAnalyticsService = engagementAnalyticsService;
        this.progressionResponseMapper = progressionResponseMapper;
    }

    @PostMapping
    public ResponseEntity<ProgressionResponses.EngagementMetric> recordEngagement(
            @Valid @RequestBody ProgressionRequests.RecordEngagementRequest request
    ) {
        EngagementMetric metric = contributionService.recordEngagement(
                request.userId(), request.metricType(), request.value(), request.metadata());
        return ResponseEntity.status(HttpStatus.CREATED).body(progressionResponseMapper.toMetricResponse(metric));
    }

    @GetMapping("/users/{userId}")
    public ResponseEntity<EngagementLedgerService.UserEngagementBreakdown> getUserEngagement(@PathVariable String userId) {
        return ResponseEntity.ok(engagementLedgerService.getUserEngagement(userId));
    }

    @GetMapping("/leaderboard")
    public ResponseEntity<List<EngagementLedgerService.LeaderboardEntry>> getLeaderboard(
            @RequestParam(defaultValue = "0") int limit
    ) {
        return ResponseEntity.ok(engagementLedgerService.getContributionLeaderboard(limit));
    }

    @GetMapping("/velocity")
    public ResponseEntity<EngagementAnalyticsService.VelocityMetrics> getVelocity(
            @RequestParam(defaultValue = "7") int days
    ) {
        return ResponseEntity.ok(engagementAnalyticsService.getEngagementVelocity(days));
    }

    @GetMapping("/estimate/{nodeKey}")
    public ResponseEntity<EngagementAnalyticsService.UnlockEstimate> estimateUnlockTime(@PathVariable String nodeKey) {
        return ResponseEntity.ok(engagementAnalyticsService.estimateUnlockTime(nodeKey));
    }
}
