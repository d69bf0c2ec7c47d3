/* (C)2026 */
package com.ammann.aggregate.model;

/**
 * Everything derived for one period from its own numbers and the preceding sibling.
 *
 * @param stats              statistics over the period's own numbers
 * @param deltas             {@code stats} minus the prior sibling's stats, field by field
 * @param percents           {@code deltas} relative to the prior sibling's stats
 * @param cumulatives        statistics over the whole history up to and including this period
 * @param cumulativeDeltas   {@code cumulatives} minus the prior sibling's cumulatives
 * @param cumulativePercents {@code cumulativeDeltas} relative to the prior cumulatives
 */
public record DerivedStats(
        NumberStats stats,
        NumberStats deltas,
        StatsPercents percents,
        NumberStats cumulatives,
        NumberStats cumulativeDeltas,
        StatsPercents cumulativePercents) {}
