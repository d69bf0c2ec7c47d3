/* (C)2026 */
package com.ammann.aggregate.service;

import com.ammann.aggregate.enumeration.TimePeriod;
import com.ammann.aggregate.model.NumberStats;
import com.ammann.aggregate.model.PeriodAggregate;
import com.ammann.aggregate.model.StatsPercents;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Lookups over an aggregate list for consumers that compare a period with earlier ones.
 */
@ApplicationScoped
public class PeriodAggregateLookupService {

    /**
     * Maps every key to the most recent aggregate before it that has numbers. Periods
     * without numbers are skipped as comparison targets but still get an entry.
     *
     * @param items aggregates of one granularity in chronological order
     * @return key to prior populated aggregate; the value is {@code null} when there is none
     */
    public Map<String, PeriodAggregate> buildPriorAggregateMap(List<PeriodAggregate> items) {
        Map<String, PeriodAggregate> priors = new HashMap<>();
        PeriodAggregate lastPopulated = null;
        for (PeriodAggregate item : items) {
            priors.put(item.dateKey(), lastPopulated);
            if (item.hasNumbers()) {
                lastPopulated = item;
            }
        }
        return priors;
    }

    /**
     * Placeholder aggregate for a period without any record, e.g. a calendar cell for a day
     * nothing was logged on.
     */
    public PeriodAggregate createEmptyAggregate(String dateKey, TimePeriod period) {
        return new PeriodAggregate(
                dateKey,
                period,
                List.of(),
                NumberStats.EMPTY,
                NumberStats.EMPTY,
                StatsPercents.NONE,
                NumberStats.EMPTY,
                NumberStats.EMPTY,
                StatsPercents.NONE,
                null);
    }
}
