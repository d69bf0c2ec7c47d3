/* (C)2026 */
package com.ammann.aggregate.model;

import com.ammann.aggregate.enumeration.StatsField;
import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Summary statistics over a finite sequence of numbers.
 *
 * <p>The empty sequence is represented by {@link #EMPTY}, where every field is {@code 0}.
 * No field is ever NaN, so consumers can compare any field against a threshold without
 * special-casing empty periods.
 *
 * @param count  number of values
 * @param total  sum of all values
 * @param mean   arithmetic mean ({@code total / count})
 * @param median middle value of the sorted sequence, or the average of the two middle values
 * @param min    lowest value
 * @param max    highest value
 * @param first  first value in chronological order
 * @param last   last value in chronological order
 * @param range  {@code max - min}
 * @param change {@code last - first}
 * @param changePercent {@code change / |first| * 100}, or {@code 0} when {@code first} is {@code 0}
 */
public record NumberStats(
        long count,
        double total,
        double mean,
        double median,
        double min,
        double max,
        double first,
        double last,
        double range,
        double change,
        double changePercent) {

    /** Statistics of the empty sequence. */
    public static final NumberStats EMPTY = new NumberStats(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);

    @JsonIgnore
    public boolean isEmpty() {
        return count == 0;
    }

    /**
     * Percent change from a first value, {@code 0} when the first value is {@code 0}.
     */
    public static double percentChange(double first, double change) {
        return first != 0.0 ? change / Math.abs(first) * 100.0 : 0.0;
    }

    /**
     * Reads a single field by name.
     */
    public double get(StatsField field) {
        return field.valueOf(this);
    }
}
