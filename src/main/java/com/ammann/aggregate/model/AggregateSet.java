/* (C)2026 */
package com.ammann.aggregate.model;

import java.util.List;

/**
 * Aggregates for every granularity. Each keys list is index-aligned with its aggregate list.
 */
public record AggregateSet(
        List<String> dayKeys,
        List<String> weekKeys,
        List<String> monthKeys,
        List<String> yearKeys,
        List<PeriodAggregate> days,
        List<PeriodAggregate> weeks,
        List<PeriodAggregate> months,
        List<PeriodAggregate> years,
        PeriodAggregate alltime) {

    public AggregateSet {
        dayKeys = List.copyOf(dayKeys);
        weekKeys = List.copyOf(weekKeys);
        monthKeys = List.copyOf(monthKeys);
        yearKeys = List.copyOf(yearKeys);
        days = List.copyOf(days);
        weeks = List.copyOf(weeks);
        months = List.copyOf(months);
        years = List.copyOf(years);
    }
}
