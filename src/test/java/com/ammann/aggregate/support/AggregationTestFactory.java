/* (C)2026 */
package com.ammann.aggregate.support;

import com.ammann.aggregate.model.DayRecord;
import com.ammann.aggregate.model.PeriodAggregate;
import com.ammann.aggregate.service.DateKeyService;
import com.ammann.aggregate.service.DerivedStatsService;
import com.ammann.aggregate.service.ExtremesService;
import com.ammann.aggregate.service.NumberStatsService;
import com.ammann.aggregate.service.PeriodAggregationService;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

public final class AggregationTestFactory {

    private AggregationTestFactory() {}

    public static PeriodAggregationService aggregationService(MeterRegistry meterRegistry) {
        return new PeriodAggregationService(
                new DateKeyService(),
                new DerivedStatsService(new NumberStatsService()),
                new ExtremesService(),
                meterRegistry);
    }

    public static DayRecord day(String dateKey, double... numbers) {
        return DayRecord.of(dateKey, numbers);
    }

    /**
     * One record every {@code stepDays} days starting at {@code start}, with numbers derived
     * from the day index so that neighbouring days differ.
     */
    public static List<DayRecord> buildLog(LocalDate start, int count, int stepDays) {
        List<DayRecord> log = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            LocalDate date = start.plusDays((long) i * stepDays);
            double base = (i * 7919 % 23) - 8;
            double[] numbers = i % 5 == 0 ? new double[] {base} : new double[] {base, base / 2, i % 3};
            log.add(DayRecord.of(date.toString(), numbers));
        }
        return log;
    }

    public static List<Double> flattenNumbers(List<PeriodAggregate> aggregates) {
        List<Double> numbers = new ArrayList<>();
        for (PeriodAggregate aggregate : aggregates) {
            numbers.addAll(aggregate.numbers());
        }
        return numbers;
    }
}
