package com.brandish.progression.repository;

public interface ContributionLeaderboardRow {

    String getUserId();

    Long getTotalContribution();

    Long getRank();
}
