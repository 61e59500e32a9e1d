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
 * One unlocked (node, level) pair. Rows are inserted through
 * {@code ProgressionUnlockRepository#insertIfAbsent} so duplicate unlocks collapse on the
 * unique (node_id, current_level) constraint.
 */
@Getter
@Setter
@Entity
@Table(name = "progression_unlocks")
public class ProgressionUnlock {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "node_id", nullable = false)
    private Integer nodeId;

    @Column(name = "current_level", nullable = false)
    private Integer currentLevel = 1;

    @Column(name = "unlocked_at", nullable = false)
    private OffsetDateTime unlockedAt = OffsetDateTime.now();

    @Column(name = "unlocked_by", nullable = false, length = 100)
    private String unlockedBy;

    @Column(name = "engagement_score", nullable = false)
    private Long engagementScore = 0L;
}
