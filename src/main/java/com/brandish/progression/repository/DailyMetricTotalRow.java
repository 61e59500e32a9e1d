package com.brandish.progression.repository;

public interface DailyMetricTotalRow {

    /**
     * Calendar day as {@code yyyy-MM-dd}.
     */
    String getDay();

    String getMetricType();

    Long getTotal();
}
