/* (C)2026 */
package com.ammann.aggregate.service;

import com.ammann.aggregate.enumeration.StatsField;
import com.ammann.aggregate.model.DerivedStats;
import com.ammann.aggregate.model.NumberStats;
import com.ammann.aggregate.model.StatsPercents;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Derives the stats of one period together with its deltas, percents and cumulatives
 * against the immediately preceding sibling period.
 *
 * <p>Conventions:
 * <ul>
 *   <li>Without a prior period the baseline is the stats of the period's first value alone,
 *       so the first period of a chain shows its movement away from where it opened. An
 *       empty first period has empty deltas.</li>
 *   <li>Without prior cumulatives, cumulative deltas are {@link NumberStats#EMPTY} and
 *       cumulative percents are undefined.</li>
 *   <li>A percent is {@code delta / |prior| * 100}; it is undefined when there is no prior
 *       period or the prior value is {@code 0}.</li>
 *   <li>Cumulative mean is cumulative total over cumulative count. Cumulative median is
 *       the exact median of the whole history prefix, read from a {@link RunningMedian}
 *       the caller threads through the chain.</li>
 * </ul>
 */
@ApplicationScoped
public class DerivedStatsService {

    private final NumberStatsService numberStatsService;

    @Inject
    public DerivedStatsService(NumberStatsService numberStatsService) {
        this.numberStatsService = numberStatsService;
    }

    /**
     * Derives all stats for a period.
     *
     * @param numbers          the period's numbers in chronological order
     * @param priorStats       stats of the preceding sibling, or {@code null} for the first period
     * @param priorCumulatives cumulatives of the preceding sibling, or {@code null}
     * @param history          every number of the history before this period; this period's
     *                         numbers are added to it
     * @return the derived stats
     */
    public DerivedStats derive(
            List<Double> numbers,
            NumberStats priorStats,
            NumberStats priorCumulatives,
            RunningMedian history) {
        NumberStats stats = numberStatsService.computeNumberStats(numbers);
        history.addAll(numbers);
        NumberStats cumulatives = computeCumulatives(stats, priorCumulatives, history.median());

        return new DerivedStats(
                stats,
                computeDeltas(stats, priorStats),
                computePercents(stats, priorStats),
                cumulatives,
                priorCumulatives == null ? NumberStats.EMPTY : computeDeltas(cumulatives, priorCumulatives),
                priorCumulatives == null ? StatsPercents.NONE : computePercents(cumulatives, priorCumulatives));
    }

    /**
     * Field-wise {@code current - prior}. A missing prior is replaced by the stats of the
     * current period's first value.
     */
    public NumberStats computeDeltas(NumberStats current, NumberStats prior) {
        NumberStats baseline = prior == null ? firstValueBaseline(current) : prior;
        if (baseline == null) {
            return NumberStats.EMPTY;
        }
        return subtract(current, baseline);
    }

    private static NumberStats subtract(NumberStats current, NumberStats prior) {
        return new NumberStats(
                current.count() - prior.count(),
                current.total() - prior.total(),
                current.mean() - prior.mean(),
                current.median() - prior.median(),
                current.min() - prior.min(),
                current.max() - prior.max(),
                current.first() - prior.first(),
                current.last() - prior.last(),
                current.range() - prior.range(),
                current.change() - prior.change(),
                current.changePercent() - prior.changePercent());
    }

    /**
     * Field-wise percent change against the prior stats, or against the first-value baseline
     * when there is no prior. Fields whose baseline value is zero are left undefined.
     */
    public StatsPercents computePercents(NumberStats current, NumberStats prior) {
        NumberStats reference = prior == null ? firstValueBaseline(current) : prior;
        if (reference == null) {
            return StatsPercents.NONE;
        }
        Map<StatsField, Double> percents = new EnumMap<>(StatsField.class);
        for (StatsField field : StatsField.values()) {
            double baseline = reference.get(field);
            if (baseline != 0.0) {
                percents.put(field, (current.get(field) - baseline) / Math.abs(baseline) * 100.0);
            }
        }
        return StatsPercents.of(percents);
    }

    /**
     * Stats of the single value a period opened with, or {@code null} for an empty period.
     */
    private NumberStats firstValueBaseline(NumberStats current) {
        if (current.isEmpty()) {
            return null;
        }
        return numberStatsService.computeNumberStats(List.of(current.first()));
    }

    /**
     * Folds a period's stats into the cumulatives of the history before it.
     *
     * @param stats            stats of the period
     * @param priorCumulatives cumulatives up to the preceding period, or {@code null}
     * @param prefixMedian     exact median over the history including this period
     * @return cumulatives up to and including this period
     */
    NumberStats computeCumulatives(NumberStats stats, NumberStats priorCumulatives, double prefixMedian) {
        if (priorCumulatives == null || priorCumulatives.isEmpty()) {
            if (stats.isEmpty()) {
                return NumberStats.EMPTY;
            }
            return new NumberStats(
                    stats.count(),
                    stats.total(),
                    stats.mean(),
                    prefixMedian,
                    stats.min(),
                    stats.max(),
                    stats.first(),
                    stats.last(),
                    stats.range(),
                    stats.change(),
                    stats.changePercent());
        }
        if (stats.isEmpty()) {
            return priorCumulatives;
        }

        long count = priorCumulatives.count() + stats.count();
        double total = priorCumulatives.total() + stats.total();
        double min = Math.min(priorCumulatives.min(), stats.min());
        double max = Math.max(priorCumulatives.max(), stats.max());
        double first = priorCumulatives.first();
        double last = stats.last();
        double change = last - first;

        return new NumberStats(
                count,
                total,
                total / count,
                prefixMedian,
                min,
                max,
                first,
                last,
                max - min,
                change,
                NumberStats.percentChange(first, change));
    }
}
