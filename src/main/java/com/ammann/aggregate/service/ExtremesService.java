/* (C)2026 */
package com.ammann.aggregate.service;

import com.ammann.aggregate.enumeration.StatsField;
import com.ammann.aggregate.model.NumberStats;
import com.ammann.aggregate.model.PeriodAggregate;
import com.ammann.aggregate.model.StatsExtremes;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Computes the highest and lowest value of every statistic among a container's direct
 * children.
 *
 * <p>The minimum number of children a container needs before it carries extremes is
 * configurable via {@code aggregate.extremes.min-children} and defaults to two, so a
 * container with a single child carries none. An empty child list never produces extremes.
 */
@ApplicationScoped
public class ExtremesService {

    private static final Logger LOG = Logger.getLogger(ExtremesService.class);

    static final int DEFAULT_MIN_CHILDREN = 2;

    @ConfigProperty(name = "aggregate.extremes.min-children", defaultValue = "2")
    int minChildren = DEFAULT_MIN_CHILDREN;

    /**
     * Calculates extremes across the given child stats.
     *
     * @param stats stats of the direct children
     * @return extremes, or {@code null} when there are fewer children than required
     */
    public StatsExtremes calculateExtremes(List<NumberStats> stats) {
        if (stats == null || stats.isEmpty() || stats.size() < minChildren) {
            return null;
        }

        Map<StatsField, Double> highest = new EnumMap<>(StatsField.class);
        Map<StatsField, Double> lowest = new EnumMap<>(StatsField.class);
        for (StatsField field : StatsField.values()) {
            double high = Double.NEGATIVE_INFINITY;
            double low = Double.POSITIVE_INFINITY;
            for (NumberStats child : stats) {
                double value = child.get(field);
                high = Math.max(high, value);
                low = Math.min(low, value);
            }
            highest.put(field, high);
            lowest.put(field, low);
        }
        return new StatsExtremes(highest, lowest);
    }

    /**
     * Returns {@code previous} when it holds the same values as {@code computed}, so that
     * consumers memoizing on identity see no change.
     */
    public StatsExtremes preserveIdentity(StatsExtremes previous, StatsExtremes computed) {
        if (previous == null || computed == null) {
            return computed;
        }
        return previous.sameValues(computed) ? previous : computed;
    }

    /**
     * Extremes across the non-empty days of one year, e.g. for scaling a year chart by its
     * daily minimum and maximum.
     *
     * @param days day aggregates, in any order
     * @param year calendar year to select
     * @return extremes of the selected days' stats, or {@code null} if too few have data
     */
    public StatsExtremes calculateDailyExtremes(List<PeriodAggregate> days, int year) {
        String prefix = String.format("%04d-", year);
        List<NumberStats> yearStats = days.stream()
                .filter(day -> day.dateKey() != null && day.dateKey().startsWith(prefix))
                .map(PeriodAggregate::stats)
                .filter(stats -> !stats.isEmpty())
                .toList();
        LOG.debugf("Computing daily extremes for %d from %d populated days", year, yearStats.size());
        return calculateExtremes(yearStats);
    }
}
