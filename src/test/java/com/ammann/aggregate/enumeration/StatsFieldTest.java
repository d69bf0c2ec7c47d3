/* (C)2026 */
package com.ammann.aggregate.enumeration;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.aggregate.model.NumberStats;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class StatsFieldTest {

    private static final NumberStats STATS = new NumberStats(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11);

    @Test
    void readsEveryField() {
        StatsField[] fields = StatsField.values();
        for (int i = 0; i < fields.length; i++) {
            assertThat(fields[i].valueOf(STATS)).isEqualTo(i + 1.0);
            assertThat(STATS.get(fields[i])).isEqualTo(i + 1.0);
        }
    }

    @ParameterizedTest
    @EnumSource(StatsField.class)
    void hasLabelAndDescription(StatsField field) {
        assertThat(field.getLabel()).isNotBlank();
        assertThat(field.getDescription()).isNotBlank();
    }

    @Test
    void onlyDayIsNotAContainer() {
        assertThat(TimePeriod.DAY.isContainer()).isFalse();
        assertThat(TimePeriod.WEEK.isContainer()).isTrue();
        assertThat(TimePeriod.ANYTIME.isContainer()).isTrue();
        assertThat(TimePeriod.ANYTIME.getLabel()).isEqualTo("anytime");
    }
}
