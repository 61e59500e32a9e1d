package com.brandish.progression.model;

import jakarta.persistence.*;

import java.time.OffsetDateTime;

@Entity
@Table(name = "progression_resets")
public class ProgressionReset {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "reset_at", nullable = false)
    private OffsetDateTime resetAt = OffsetDateTime.now();

    @Column(name = "reset_by", nullable = false, length = 100)
    private String resetBy;

    @Column(name = "reason", columnDefinition = "TEXT")
    private String reason;

    @Column(name = "nodes_reset_count", nullable = false)
    private Integer nodesResetCount = 0;

    @Column(name = "engagement_score_at_reset", nullable = false)
    private Long engagementScoreAtReset = 0L;

    public Integer getId() {
        return id;
    }

    public void setId(Integer id) {
        this.id = id;
    }

    public OffsetDateTime getResetAt() {
        return resetAt;
    }

    public void setResetAt(OffsetDateTime resetAt) {
        this.resetAt = resetAt;
    }

    public String getResetBy() {
        return resetBy;
    }

    public void setResetBy(String resetBy) {
        this.resetBy = resetBy;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public Integer getNodesResetCount() {
        return nodesResetCount;
    }

    public void setNodesResetCount(Integer nodesResetCount) {
        this.nodesResetCount = nodesResetCount;
    }

    public Long getEngagementScoreAtReset() {
        return engagementScoreAtReset;
    }

    public void setEngagementScoreAtReset(Long engagementScoreAtReset) {
        this.engagementScoreAtReset = engagementScoreAtReset;
    }
}
