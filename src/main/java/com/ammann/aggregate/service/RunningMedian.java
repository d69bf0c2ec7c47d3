/* (C)2026 */
package com.ammann.aggregate.service;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Exact median over a growing multiset of numbers.
 *
 * <p>Values are kept in a sorted primitive array. Single inserts use binary search and an
 * array shift; the median is read in constant time. Not thread-safe; one instance follows one
 * chain of periods through a single recompute.
 */
public final class RunningMedian {

    private static final int INITIAL_CAPACITY = 16;

    private double[] values;
    private int size;

    public RunningMedian() {
        this.values = new double[INITIAL_CAPACITY];
    }

    private RunningMedian(double[] sorted, int size) {
        this.values = sorted;
        this.size = size;
    }

    /**
     * Seeds an instance with every number of the given chunks. Sorts once instead of
     * inserting one value at a time.
     *
     * @param chunks number lists, e.g. the numbers of every period before a recompute boundary
     */
    public static RunningMedian seededWith(Collection<? extends List<Double>> chunks) {
        int total = 0;
        for (List<Double> chunk : chunks) {
            total += chunk.size();
        }
        double[] sorted = new double[Math.max(INITIAL_CAPACITY, total)];
        int index = 0;
        for (List<Double> chunk : chunks) {
            for (Double value : chunk) {
                sorted[index++] = value;
            }
        }
        Arrays.sort(sorted, 0, total);
        return new RunningMedian(sorted, total);
    }

    public void add(double value) {
        if (size == values.length) {
            values = Arrays.copyOf(values, values.length * 2);
        }
        int position = Arrays.binarySearch(values, 0, size, value);
        if (position < 0) {
            position = -position - 1;
        }
        System.arraycopy(values, position, values, position + 1, size - position);
        values[position] = value;
        size++;
    }

    /**
     * Adds a batch by sorting it and merging it in from the back, so a period with many
     * numbers costs one pass over the existing values rather than one shift per value.
     */
    public void addAll(List<Double> numbers) {
        int count = numbers.size();
        if (count == 0) {
            return;
        }
        if (count == 1) {
            add(numbers.get(0));
            return;
        }
        double[] batch = new double[count];
        for (int i = 0; i < count; i++) {
            batch[i] = numbers.get(i);
        }
        Arrays.sort(batch);

        int merged = size + count;
        if (merged > values.length) {
            values = Arrays.copyOf(values, Math.max(merged, values.length * 2));
        }
        int left = size - 1;
        int right = count - 1;
        for (int target = merged - 1; right >= 0; target--) {
            if (left >= 0 && Double.compare(values[left], batch[right]) > 0) {
                values[target] = values[left--];
            } else {
                values[target] = batch[right--];
            }
        }
        size = merged;
    }

    /**
     * Returns the median of everything added so far, or {@code 0} when empty.
     */
    public double median() {
        if (size == 0) {
            return 0.0;
        }
        if (size % 2 == 0) {
            return (values[size / 2 - 1] + values[size / 2]) / 2.0;
        }
        return values[size / 2];
    }

    public int size() {
        return size;
    }
}
