/* (C)2026 */
package com.ammann.aggregate.model;

import java.util.Arrays;
import java.util.List;

/**
 * One day of the measurement log as handed over by the log store.
 *
 * <p>The store is expected to return the same instance for a day that has not changed
 * since the previous snapshot; the aggregation engine detects changes by reference.
 *
 * @param dateKey day key in {@code yyyy-MM-dd} form
 * @param numbers measurements recorded on that day, in entry order
 */
public record DayRecord(String dateKey, List<Double> numbers) {

    public DayRecord {
        numbers = numbers == null ? List.of() : List.copyOf(numbers);
    }

    public static DayRecord of(String dateKey, double... numbers) {
        return new DayRecord(dateKey, Arrays.stream(numbers).boxed().toList());
    }
}
