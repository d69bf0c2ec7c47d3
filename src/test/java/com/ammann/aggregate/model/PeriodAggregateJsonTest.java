/* (C)2026 */
package com.ammann.aggregate.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.aggregate.enumeration.StatsField;
import com.ammann.aggregate.enumeration.TimePeriod;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PeriodAggregateJsonTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void omitsMissingKeyAndExtremes() throws Exception {
        NumberStats stats = new NumberStats(2, 3, 1.5, 1.5, 1, 2, 1, 2, 1, 1, 100);
        PeriodAggregate aggregate = new PeriodAggregate(
                null,
                TimePeriod.ANYTIME,
                List.of(1.0, 2.0),
                stats,
                stats,
                StatsPercents.NONE,
                stats,
                stats,
                StatsPercents.of(Map.of(StatsField.TOTAL, 50.0)),
                null);

        JsonNode json = mapper.readTree(mapper.writeValueAsString(aggregate));

        assertThat(json.has("dateKey")).isFalse();
        assertThat(json.has("extremes")).isFalse();
        assertThat(json.get("period").asText()).isEqualTo("ANYTIME");
        assertThat(json.get("stats").get("total").asDouble()).isEqualTo(3.0);
        assertThat(json.get("stats").has("empty")).isFalse();
        assertThat(json.get("stats").get("changePercent").asDouble()).isEqualTo(100.0);
        assertThat(json.get("percents").size()).isZero();
        assertThat(json.get("cumulativePercents").get("TOTAL").asDouble()).isEqualTo(50.0);
    }
}
