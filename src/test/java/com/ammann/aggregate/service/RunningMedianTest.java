/* (C)2026 */
package com.ammann.aggregate.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class RunningMedianTest {

    @Test
    void emptyMedianIsZero() {
        RunningMedian median = new RunningMedian();

        assertThat(median.size()).isZero();
        assertThat(median.median()).isZero();
    }

    @Test
    void tracksMedianAcrossSingleInserts() {
        RunningMedian median = new RunningMedian();

        median.add(5.0);
        assertThat(median.median()).isEqualTo(5.0);
        median.add(3.0);
        assertThat(median.median()).isEqualTo(4.0);
        median.add(-2.0);
        assertThat(median.median()).isEqualTo(3.0);
    }

    @Test
    void batchInsertMergesIntoExistingValues() {
        RunningMedian median = RunningMedian.seededWith(List.of(List.of(10.0, 1.0), List.of(7.0)));

        median.addAll(List.of(2.0, 9.0, 2.0));

        assertThat(median.size()).isEqualTo(6);
        // sorted: 1 2 2 7 9 10
        assertThat(median.median()).isEqualTo(4.5);
    }

    @Test
    void growsBeyondInitialCapacity() {
        RunningMedian median = new RunningMedian();
        List<Double> values = IntStream.rangeClosed(1, 101).mapToObj(i -> (double) (102 - i)).toList();

        median.addAll(values.subList(0, 50));
        values.subList(50, 101).forEach(median::add);

        assertThat(median.size()).isEqualTo(101);
        assertThat(median.median()).isEqualTo(51.0);
    }
}
