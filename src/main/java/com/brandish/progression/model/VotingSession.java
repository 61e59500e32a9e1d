package com.brandish.progression.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * Ballot over the next unlock. Status flows VOTING -> FROZEN <-> VOTING -> COMPLETED;
 * COMPLETED is terminal and the database allows only one open (VOTING or FROZEN) session.
 */
@Getter
@Setter
@Entity
@Table(name = "progression_voting_sessions")
public class VotingSession {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private VotingSessionStatus status = VotingSessionStatus.VOTING;

    @Column(name = "started_at", nullable = false)
    private OffsetDateTime startedAt = OffsetDateTime.now();

    @Column(name = "voting_deadline", nullable = false)
    private OffsetDateTime votingDeadline;

    @Column(name = "ended_at")
    private OffsetDateTime endedAt;

    @Column(name = "winning_option_id")
    private Integer winningOptionId;

    public boolean isOpen() {
        return status == VotingSessionStatus.VOTING || status == VotingSessionStatus.FROZEN;
    }
}
