package com.brandish.progression.repository;

public interface NodeLevelRow {

    Integer getNodeId();

    Integer getLevel();
}
