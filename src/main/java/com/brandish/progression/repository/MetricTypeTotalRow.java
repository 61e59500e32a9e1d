package com.brandish.progression.repository;

public interface MetricTypeTotalRow {

    String getMetricType();

    Long getTotal();
}
