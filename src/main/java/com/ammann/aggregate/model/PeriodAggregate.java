/* (C)2026 */
package com.ammann.aggregate.model;

import com.ammann.aggregate.enumeration.TimePeriod;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Aggregated statistics of one period at one granularity.
 *
 * <p>Instances are immutable and shared between consecutive recompute runs while the
 * period is unaffected by a log change, so consumers may memoize on identity.
 *
 * @param dateKey            key of the period; {@code null} only for {@link TimePeriod#ANYTIME}
 * @param period             granularity
 * @param numbers            every number of the period in chronological order
 * @param stats              statistics over {@code numbers}
 * @param deltas             change against the preceding sibling
 * @param percents           percent change against the preceding sibling
 * @param cumulatives        statistics over the history prefix ending with this period
 * @param cumulativeDeltas   change of {@code cumulatives} against the preceding sibling
 * @param cumulativePercents percent change of {@code cumulatives}
 * @param extremes           extremes of the direct children's stats; {@code null} for days
 *                           and for containers without enough children
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PeriodAggregate(
        String dateKey,
        TimePeriod period,
        List<Double> numbers,
        NumberStats stats,
        NumberStats deltas,
        StatsPercents percents,
        NumberStats cumulatives,
        NumberStats cumulativeDeltas,
        StatsPercents cumulativePercents,
        StatsExtremes extremes) {

    public PeriodAggregate {
        numbers = List.copyOf(numbers);
    }

    public static PeriodAggregate of(
            String dateKey, TimePeriod period, List<Double> numbers, DerivedStats derived) {
        return new PeriodAggregate(
                dateKey,
                period,
                numbers,
                derived.stats(),
                derived.deltas(),
                derived.percents(),
                derived.cumulatives(),
                derived.cumulativeDeltas(),
                derived.cumulativePercents(),
                null);
    }

    /**
     * Returns a copy carrying the given extremes.
     */
    public PeriodAggregate withExtremes(StatsExtremes extremes) {
        return new PeriodAggregate(
                dateKey,
                period,
                numbers,
                stats,
                deltas,
                percents,
                cumulatives,
                cumulativeDeltas,
                cumulativePercents,
                extremes);
    }

    public boolean hasNumbers() {
        return !numbers.isEmpty();
    }
}
