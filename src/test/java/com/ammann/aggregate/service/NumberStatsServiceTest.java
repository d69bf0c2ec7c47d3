/* (C)2026 */
package com.ammann.aggregate.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.ammann.aggregate.enumeration.StatsField;
import com.ammann.aggregate.model.NumberStats;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link NumberStatsService}.
 */
class NumberStatsServiceTest {

    private final NumberStatsService service = new NumberStatsService();

    @Test
    void computesStatsForNumberList() {
        NumberStats stats = service.computeNumberStats(List.of(1.0, 2.0, 3.0));

        assertThat(stats).isEqualTo(new NumberStats(3, 6.0, 2.0, 2.0, 1.0, 3.0, 1.0, 3.0, 2.0, 2.0, 200.0));
    }

    @Test
    void medianOfEvenCountAveragesMiddleValues() {
        NumberStats stats = service.computeNumberStats(List.of(3.0, -2.0));

        assertThat(stats.count()).isEqualTo(2);
        assertThat(stats.total()).isEqualTo(1.0);
        assertThat(stats.mean()).isEqualTo(0.5);
        assertThat(stats.median()).isEqualTo(0.5);
        assertThat(stats.min()).isEqualTo(-2.0);
        assertThat(stats.max()).isEqualTo(3.0);
        assertThat(stats.first()).isEqualTo(3.0);
        assertThat(stats.last()).isEqualTo(-2.0);
        assertThat(stats.range()).isEqualTo(5.0);
        assertThat(stats.change()).isEqualTo(-5.0);
        assertThat(stats.changePercent()).isCloseTo(-500.0 / 3.0, within(1e-9));
    }

    @Test
    void changePercentIsZeroWhenFirstValueIsZero() {
        NumberStats stats = service.computeNumberStats(List.of(0.0, 5.0));

        assertThat(stats.change()).isEqualTo(5.0);
        assertThat(stats.changePercent()).isZero();
    }

    @Test
    void changePercentUsesAbsoluteFirstValue() {
        NumberStats stats = service.computeNumberStats(List.of(-4.0, -2.0));

        assertThat(stats.changePercent()).isEqualTo(50.0);
    }

    @Test
    void handlesDuplicatesAndUnsortedInput() {
        NumberStats stats = service.computeNumberStats(List.of(4.0, 1.0, 4.0, 2.0, 4.0));

        assertThat(stats.median()).isEqualTo(4.0);
        assertThat(stats.min()).isEqualTo(1.0);
        assertThat(stats.max()).isEqualTo(4.0);
        assertThat(stats.total()).isEqualTo(15.0);
    }

    @Test
    void emptyInputYieldsEmptyConvention() {
        assertThat(service.computeNumberStats(List.of())).isSameAs(NumberStats.EMPTY);
        assertThat(service.computeNumberStats(null)).isSameAs(NumberStats.EMPTY);
        for (StatsField field : StatsField.values()) {
            assertThat(NumberStats.EMPTY.get(field)).isZero();
        }
    }

    @Test
    void doesNotMutateInput() {
        List<Double> numbers = new ArrayList<>(List.of(5.0, 1.0, 3.0));

        service.computeNumberStats(numbers);

        assertThat(numbers).containsExactly(5.0, 1.0, 3.0);
    }

    @Test
    void computesStatsForSpecificMetric() {
        NumberStats a = service.computeNumberStats(List.of(1.0, 3.0));
        NumberStats b = service.computeNumberStats(List.of(2.0, 4.0));

        NumberStats totals = service.computeMetricStats(List.of(a, b), StatsField.TOTAL);

        assertThat(totals.count()).isEqualTo(2);
        assertThat(totals.total()).isEqualTo(10.0);
        assertThat(totals.min()).isEqualTo(4.0);
        assertThat(totals.max()).isEqualTo(6.0);
        assertThat(totals.change()).isEqualTo(2.0);
    }

    @Test
    void metricStatsOfNoStatsIsEmpty() {
        assertThat(service.computeMetricStats(List.of(), StatsField.TOTAL)).isSameAs(NumberStats.EMPTY);
    }
}
