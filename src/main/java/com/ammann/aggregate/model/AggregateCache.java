/* (C)2026 */
package com.ammann.aggregate.model;

import java.util.List;

/**
 * Snapshot of one recompute run, threaded by the caller into the next run.
 *
 * <p>Holds exactly one prior snapshot. A cache is never mutated after construction, so it
 * can be handed between threads as long as recomputes on one logical log are serialized.
 *
 * @param sortedDays day records of the previous run, sorted by key
 * @param days       day aggregates, aligned with {@code sortedDays}
 * @param weeks      week aggregates in key order
 * @param months     month aggregates in key order
 * @param years      year aggregates in key order
 * @param alltime    all-time aggregate, {@code null} before the first run
 */
public record AggregateCache(
        List<DayRecord> sortedDays,
        List<PeriodAggregate> days,
        List<PeriodAggregate> weeks,
        List<PeriodAggregate> months,
        List<PeriodAggregate> years,
        PeriodAggregate alltime) {

    private static final AggregateCache EMPTY =
            new AggregateCache(List.of(), List.of(), List.of(), List.of(), List.of(), null);

    public AggregateCache {
        sortedDays = List.copyOf(sortedDays);
        days = List.copyOf(days);
        weeks = List.copyOf(weeks);
        months = List.copyOf(months);
        years = List.copyOf(years);
    }

    /** Initial state: nothing has been computed yet. */
    public static AggregateCache empty() {
        return EMPTY;
    }
}
