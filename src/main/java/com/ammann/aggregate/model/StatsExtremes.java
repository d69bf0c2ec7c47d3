/* (C)2026 */
package com.ammann.aggregate.model;

import com.ammann.aggregate.enumeration.StatsField;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Highest and lowest value of every statistic observed among a container's direct
 * children (for example, the daily stats of one month).
 *
 * @param highest maximum per field, containing every {@link StatsField}
 * @param lowest  minimum per field, containing every {@link StatsField}
 */
public record StatsExtremes(Map<StatsField, Double> highest, Map<StatsField, Double> lowest) {

    public StatsExtremes {
        if (highest.size() != StatsField.values().length
                || lowest.size() != StatsField.values().length) {
            throw new IllegalArgumentException("Extremes must cover every stats field");
        }
        highest = Collections.unmodifiableMap(new EnumMap<>(highest));
        lowest = Collections.unmodifiableMap(new EnumMap<>(lowest));
    }

    public double highest(StatsField field) {
        return highest.get(field);
    }

    public double lowest(StatsField field) {
        return lowest.get(field);
    }

    /**
     * Field-by-field comparison. Two extremes are the same when every highest and lowest
     * value is numerically equal.
     */
    public boolean sameValues(StatsExtremes other) {
        if (other == null) {
            return false;
        }
        for (StatsField field : StatsField.values()) {
            if (Double.compare(highest(field), other.highest(field)) != 0
                    || Double.compare(lowest(field), other.lowest(field)) != 0) {
                return false;
            }
        }
        return true;
    }
}
