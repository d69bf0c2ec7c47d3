/* (C)2026 */
package com.ammann.aggregate.service;

import com.ammann.aggregate.enumeration.StatsField;
import com.ammann.aggregate.model.NumberStats;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.Arrays;
import java.util.List;

/**
 * Computes summary statistics over a finite sequence of numbers.
 *
 * <p>The empty sequence yields {@link NumberStats#EMPTY}; there are no error conditions.
 * The input list is never modified.
 */
@ApplicationScoped
public class NumberStatsService {

    /**
     * Calculates count, total, mean, median, min, max, first, last, range, change and
     * change percent.
     *
     * <p>The median of an even-sized sequence is the average of the two middle values
     * of the sorted sequence.
     *
     * @param numbers values in chronological order
     * @return statistics, or {@link NumberStats#EMPTY} for an empty or {@code null} list
     */
    public NumberStats computeNumberStats(List<Double> numbers) {
        if (numbers == null || numbers.isEmpty()) {
            return NumberStats.EMPTY;
        }

        int count = numbers.size();
        double[] sorted = new double[count];
        double total = 0.0;
        for (int i = 0; i < count; i++) {
            double value = numbers.get(i);
            sorted[i] = value;
            total += value;
        }
        Arrays.sort(sorted);

        double mean = total / count;
        double median = medianOfSorted(sorted, count);
        double min = sorted[0];
        double max = sorted[count - 1];
        double first = numbers.get(0);
        double last = numbers.get(count - 1);
        double change = last - first;

        return new NumberStats(
                count,
                total,
                mean,
                median,
                min,
                max,
                first,
                last,
                max - min,
                change,
                NumberStats.percentChange(first, change));
    }

    /**
     * Calculates statistics over one field of a list of stats, e.g. the distribution of
     * daily totals within a month.
     *
     * @param stats  stats in chronological order
     * @param metric field to collect from every entry
     * @return statistics over the collected values
     */
    public NumberStats computeMetricStats(List<NumberStats> stats, StatsField metric) {
        if (stats == null || stats.isEmpty()) {
            return NumberStats.EMPTY;
        }
        return computeNumberStats(stats.stream().map(s -> s.get(metric)).toList());
    }

    private static double medianOfSorted(double[] sorted, int count) {
        if (count % 2 == 0) {
            return (sorted[count / 2 - 1] + sorted[count / 2]) / 2.0;
        }
        return sorted[count / 2];
    }
}
