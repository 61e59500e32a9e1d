package com.brandish.progression.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * One contribution cycle. The active cycle is the row with no {@code unlockedAt}; completing
 * it inserts a successor row instead of rewriting this one.
 */
@Getter
@Setter
@Entity
@Table(name = "progression_unlock_progress")
public class UnlockProgress {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "node_id")
    private Integer nodeId;

    @Column(name = "target_level")
    private Integer targetLevel;

    @Column(name = "voting_session_id")
    private Integer votingSessionId;

    @Column(name = "contributions_accumulated", nullable = false)
    private Integer contributionsAccumulated = 0;

    @Column(name = "started_at", nullable = false)
    private OffsetDateTime startedAt = OffsetDateTime.now();

    @Column(name = "unlocked_at")
    private OffsetDateTime unlockedAt;

    public boolean hasTarget() {
        return nodeId != null && targetLevel != null;
    }
}
