/* (C)2026 */
package com.ammann.aggregate.exception;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.aggregate.enumeration.TimePeriod;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class InvalidDateKeyExceptionTest {

    @ParameterizedTest
    @CsvSource({
        "2024-02-30,DAY,Invalid day key '2024-02-30'",
        "2024-W60,WEEK,Invalid week key '2024-W60'",
        "2024-13,MONTH,Invalid month key '2024-13'"
    })
    void buildsMalformedMessages(String key, TimePeriod period, String expected) {
        InvalidDateKeyException ex = InvalidDateKeyException.malformed(key, period);

        assertThat(ex.getMessage()).isEqualTo(expected);
        assertThat(ex.getKey()).isEqualTo(key);
    }

    @Test
    void buildsUnrecognizedMessage() {
        InvalidDateKeyException ex = InvalidDateKeyException.unrecognized("soon");

        assertThat(ex.getMessage()).isEqualTo("Unrecognized date key 'soon'");
        assertThat(ex).isInstanceOf(AggregationException.class);
    }

    @Test
    void buildsUnsupportedConversionMessage() {
        InvalidDateKeyException ex =
                InvalidDateKeyException.unsupportedConversion("2024", TimePeriod.YEAR, TimePeriod.MONTH);

        assertThat(ex.getMessage()).isEqualTo("Cannot convert year key '2024' to month");
        assertThat(ex.getKey()).isEqualTo("2024");
    }

    @Test
    void keepsCause() {
        IllegalStateException cause = new IllegalStateException("boom");

        InvalidDateKeyException ex = new InvalidDateKeyException("x", "wrapped", cause);

        assertThat(ex).hasCause(cause).hasMessage("wrapped");
    }
}
