package com.brandish.progression.model;

public enum VotingSessionStatus {
    VOTING,
    FROZEN,
    COMPLETED
}
