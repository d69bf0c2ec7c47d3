/* (C)2026 */
package com.ammann.aggregate.enumeration;

/**
 * Granularity of a {@link com.ammann.aggregate.model.PeriodAggregate}.
 *
 * <p>Periods nest strictly: days roll up into weeks and months, months roll up into years,
 * and years roll up into the single all-time span.
 */
public enum TimePeriod {
    DAY("day"),
    WEEK("week"),
    MONTH("month"),
    YEAR("year"),
    /** Unbounded span over the whole history; its aggregate has no date key. */
    ANYTIME("anytime");

    private final String label;

    TimePeriod(String label) {
        this.label = label;
    }

    /**
     * Returns {@code true} for periods that own finer-grained children and carry extremes.
     */
    public boolean isContainer() {
        return this != DAY;
    }

    public String getLabel() {
        return label;
    }
}
