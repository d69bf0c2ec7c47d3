/* (C)2026 */
package com.ammann.aggregate.enumeration;

import com.ammann.aggregate.model.NumberStats;
import java.util.function.ToDoubleFunction;

/**
 * The statistics carried by {@link NumberStats}, with a display label and description
 * for each.
 */
public enum StatsField {
    COUNT("Count", "Number of data points recorded", NumberStats::count),
    TOTAL("Total", "Sum of all values in the period", NumberStats::total),
    MEAN("Average", "Mean of all values in the period", NumberStats::mean),
    MEDIAN("Median", "Middle value when sorted", NumberStats::median),
    MIN("Minimum", "Lowest value in the period", NumberStats::min),
    MAX("Maximum", "Highest value in the period", NumberStats::max),
    FIRST("Open", "First value at the start of the period", NumberStats::first),
    LAST("Close", "Last value at the end of the period", NumberStats::last),
    RANGE("Range", "Difference between max and min values", NumberStats::range),
    CHANGE("Change", "Difference between first and last values", NumberStats::change),
    CHANGE_PERCENT("Change (%)", "Percentage change from first to last value", NumberStats::changePercent);

    private final String label;
    private final String description;
    private final ToDoubleFunction<NumberStats> accessor;

    StatsField(String label, String description, ToDoubleFunction<NumberStats> accessor) {
        this.label = label;
        this.description = description;
        this.accessor = accessor;
    }

    /**
     * Reads this field from the given stats.
     */
    public double valueOf(NumberStats stats) {
        return accessor.applyAsDouble(stats);
    }

    public String getLabel() {
        return label;
    }

    public String getDescription() {
        return description;
    }
}
