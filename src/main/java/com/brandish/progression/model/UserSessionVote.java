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
@Table(name = "progression_user_votes")
public class UserSessionVote {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "user_id", nullable = false, length = 100)
    private String userId;

    @Column(name = "session_id", nullable = false)
    private Integer sessionId;

    @Column(name = "option_id", nullable = false)
    private Integer optionId;

    @Column(name = "node_id", nullable = false)
    private Integer nodeId;

    @Column(name = "voted_at", nullable = false)
    private OffsetDateTime votedAt = OffsetDateTime.now();
}
