/* (C)2026 */
package com.ammann.aggregate.model;

import com.ammann.aggregate.enumeration.StatsField;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Percent change per statistic. A field without an entry is undefined: either there was no
 * prior period or the prior value was {@code 0}.
 */
public final class StatsPercents {

    public static final StatsPercents NONE = new StatsPercents(new EnumMap<>(StatsField.class));

    private final Map<StatsField, Double> values;

    private StatsPercents(EnumMap<StatsField, Double> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static StatsPercents of(Map<StatsField, Double> values) {
        if (values.isEmpty()) {
            return NONE;
        }
        return new StatsPercents(new EnumMap<>(values));
    }

    public OptionalDouble get(StatsField field) {
        Double value = values.get(field);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public boolean isDefined(StatsField field) {
        return values.containsKey(field);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @JsonValue
    public Map<StatsField, Double> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StatsPercents other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "StatsPercents" + values;
    }
}
