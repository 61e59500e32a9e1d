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

@Getter
@Setter
@Entity
@Table(name = "progression_voting_options")
public class VotingOption {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "session_id", nullable = false)
    private Integer sessionId;

    @Column(name = "node_id", nullable = false)
    private Integer nodeId;

    @Column(name = "target_level", nullable = false)
    private Integer targetLevel = 1;

    @Column(name = "vote_count", nullable = false)
    private Integer voteCount = 0;

    // Tie-break signal for equal vote counts, earliest wins.
    @Column(name = "last_highest_vote_at")
    private OffsetDateTime lastHighestVoteAt;
}
