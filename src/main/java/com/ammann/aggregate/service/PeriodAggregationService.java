/* (C)2026 */
package com.ammann.aggregate.service;

import com.ammann.aggregate.enumeration.NonFiniteNumberPolicy;
import com.ammann.aggregate.enumeration.TimePeriod;
import com.ammann.aggregate.exception.InvalidDateKeyException;
import com.ammann.aggregate.model.AggregateCache;
import com.ammann.aggregate.model.AggregateSet;
import com.ammann.aggregate.model.AggregationResult;
import com.ammann.aggregate.model.DayRecord;
import com.ammann.aggregate.model.DerivedStats;
import com.ammann.aggregate.model.PeriodAggregate;
import com.ammann.aggregate.model.StatsExtremes;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Incremental day, week, month, year and all-time aggregation over a per-day measurement log.
 *
 * <p>Each call receives the complete current log and the cache returned by the previous call.
 * Changes are detected by reference: the first index at which the sorted log differs from the
 * cached sorted log bounds the work. Day aggregates before that index, and week, month and
 * year aggregates before the first container touched by the change, are returned from the
 * cache unchanged by reference. Everything from there on is rebuilt, chained against the
 * preceding sibling so that deltas and cumulatives thread correctly.
 *
 * <p>The bean holds no per-log state; callers serialize calls that share a cache.
 */
@ApplicationScoped
public class PeriodAggregationService {

    private static final Logger LOG = Logger.getLogger(PeriodAggregationService.class);

    private static final Comparator<DayRecord> BY_DATE_KEY = Comparator.comparing(DayRecord::dateKey);
    private static final List<TimePeriod> ROLLUP_PERIODS =
            List.of(TimePeriod.DAY, TimePeriod.WEEK, TimePeriod.MONTH, TimePeriod.YEAR);

    static final NonFiniteNumberPolicy DEFAULT_NON_FINITE_POLICY = NonFiniteNumberPolicy.SKIP;

    @ConfigProperty(name = "aggregate.numbers.non-finite-policy", defaultValue = "SKIP")
    NonFiniteNumberPolicy nonFinitePolicy = DEFAULT_NON_FINITE_POLICY;

    private final DateKeyService dateKeyService;
    private final DerivedStatsService derivedStatsService;
    private final ExtremesService extremesService;
    private final MeterRegistry meterRegistry;

    private Counter recomputeCounter;
    private Counter rejectedRecordsCounter;
    private Counter sanitizedNumbersCounter;
    private Timer recomputeTimer;
    private final Map<TimePeriod, Counter> reusedCounters = new EnumMap<>(TimePeriod.class);
    private final Map<TimePeriod, Counter> recomputedCounters = new EnumMap<>(TimePeriod.class);

    @Inject
    public PeriodAggregationService(
            DateKeyService dateKeyService,
            DerivedStatsService derivedStatsService,
            ExtremesService extremesService,
            MeterRegistry meterRegistry) {
        this.dateKeyService = dateKeyService;
        this.derivedStatsService = derivedStatsService;
        this.extremesService = extremesService;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Registers the engine's counters and timer. Safe to call repeatedly and safe without a
     * registry, in which case metrics are disabled.
     */
    synchronized void initMetrics() {
        if (recomputeCounter != null) {
            return;
        }
        if (meterRegistry == null) {
            LOG.warn("MeterRegistry not available - aggregation metrics disabled");
            return;
        }

        recomputeCounter = Counter.builder("aggregate_recompute_total")
                .description("Number of recompute runs")
                .register(meterRegistry);
        rejectedRecordsCounter = Counter.builder("aggregate_records_rejected_total")
                .description("Day records excluded for a malformed or duplicate key")
                .register(meterRegistry);
        sanitizedNumbersCounter = Counter.builder("aggregate_numbers_sanitized_total")
                .description("Non-finite numbers skipped or replaced before aggregation")
                .tag("policy", nonFinitePolicy.name())
                .register(meterRegistry);
        recomputeTimer = Timer.builder("aggregate_recompute_duration")
                .description("Duration of one recompute run")
                .register(meterRegistry);
        for (TimePeriod period : ROLLUP_PERIODS) {
            reusedCounters.put(period, Counter.builder("aggregate_periods_reused_total")
                    .description("Aggregates served from the cache")
                    .tag("period", period.getLabel())
                    .register(meterRegistry));
            recomputedCounters.put(period, Counter.builder("aggregate_periods_recomputed_total")
                    .description("Aggregates rebuilt after a log change")
                    .tag("period", period.getLabel())
                    .register(meterRegistry));
        }
    }

    /**
     * Recomputes every aggregate for the given log, reusing whatever the change leaves intact.
     *
     * @param log      the complete log in any order; {@code null} counts as empty
     * @param previous cache returned by the previous call, or {@code null} for the first call
     * @return the aggregates and the cache to pass into the next call
     */
    public AggregationResult recompute(Collection<DayRecord> log, AggregateCache previous) {
        initMetrics();
        long startNanos = System.nanoTime();

        AggregateCache cache = previous == null ? AggregateCache.empty() : previous;
        List<DayRecord> sortedDays = sortValidDays(log);
        List<DayRecord> previousDays = cache.sortedDays();
        int changedIndex = findFirstChangedIndex(previousDays, sortedDays);

        if (changedIndex == -1 && cache.alltime() != null) {
            LOG.debugf("No log changes across %d days, serving cached aggregates", sortedDays.size());
            count(TimePeriod.DAY, cache.days().size(), 0);
            count(TimePeriod.WEEK, cache.weeks().size(), 0);
            count(TimePeriod.MONTH, cache.months().size(), 0);
            count(TimePeriod.YEAR, cache.years().size(), 0);
            AggregationResult result = new AggregationResult(toAggregateSet(cache), cache);
            recordDuration(startNanos);
            return result;
        }

        String earliestDayKey = earliestChangedKey(previousDays, sortedDays, changedIndex);
        LOG.debugf(
                "Recomputing %d days (previously %d) from index %d, earliest changed key %s",
                sortedDays.size(), previousDays.size(), changedIndex, earliestDayKey);

        List<PeriodAggregate> days = buildDays(sortedDays, cache.days(), changedIndex);

        TreeMap<String, List<PeriodAggregate>> daysByWeek = groupBy(days, TimePeriod.WEEK);
        TreeMap<String, List<PeriodAggregate>> daysByMonth = groupBy(days, TimePeriod.MONTH);
        List<PeriodAggregate> weeks = rollUp(TimePeriod.WEEK, daysByWeek, cache.weeks(), earliestDayKey);
        List<PeriodAggregate> months = rollUp(TimePeriod.MONTH, daysByMonth, cache.months(), earliestDayKey);

        TreeMap<String, List<PeriodAggregate>> monthsByYear = groupBy(months, TimePeriod.YEAR);
        List<PeriodAggregate> years = rollUp(TimePeriod.YEAR, monthsByYear, cache.years(), earliestDayKey);

        PeriodAggregate alltime = buildAlltime(years, cache.alltime());

        AggregateCache nextCache = new AggregateCache(sortedDays, days, weeks, months, years, alltime);
        AggregationResult result = new AggregationResult(toAggregateSet(nextCache), nextCache);
        recordDuration(startNanos);
        return result;
    }

    /**
     * Drops records with malformed or duplicate keys and sorts the rest by day key. Of several
     * records sharing a key, the one that came first in the log is kept.
     */
    List<DayRecord> sortValidDays(Collection<DayRecord> log) {
        if (log == null || log.isEmpty()) {
            return List.of();
        }

        List<DayRecord> valid = new ArrayList<>(log.size());
        for (DayRecord record : log) {
            if (record == null) {
                LOG.warn("Skipping null day record");
                increment(rejectedRecordsCounter);
                continue;
            }
            try {
                dateKeyService.requireDayKey(record.dateKey());
                valid.add(record);
            } catch (InvalidDateKeyException e) {
                LOG.warnf("Skipping day record: %s", e.getMessage());
                increment(rejectedRecordsCounter);
            }
        }
        valid.sort(BY_DATE_KEY);

        List<DayRecord> unique = new ArrayList<>(valid.size());
        for (DayRecord record : valid) {
            if (!unique.isEmpty() && unique.get(unique.size() - 1).dateKey().equals(record.dateKey())) {
                LOG.warnf("Skipping duplicate day record for %s", record.dateKey());
                increment(rejectedRecordsCounter);
                continue;
            }
            unique.add(record);
        }
        return unique;
    }

    /**
     * Returns the first index at which the two lists hold different instances, the length of
     * the shorter list if one is a prefix of the other, or {@code -1} if they are identical.
     */
    static int findFirstChangedIndex(List<DayRecord> previous, List<DayRecord> next) {
        int common = Math.min(previous.size(), next.size());
        for (int i = 0; i < common; i++) {
            if (previous.get(i) != next.get(i)) {
                return i;
            }
        }
        return previous.size() == next.size() ? -1 : common;
    }

    /**
     * The smaller of the keys found at the changed index before and after the change. Taking
     * the smaller one makes a removed or inserted day invalidate the container it belongs to.
     */
    static String earliestChangedKey(List<DayRecord> previous, List<DayRecord> next, int changedIndex) {
        if (changedIndex == -1) {
            return null;
        }
        String before = changedIndex < previous.size() ? previous.get(changedIndex).dateKey() : null;
        String after = changedIndex < next.size() ? next.get(changedIndex).dateKey() : null;
        if (before == null) return after;
        if (after == null) return before;
        return before.compareTo(after) <= 0 ? before : after;
    }

    /**
     * Reuses cached day aggregates before the changed index and rebuilds the rest in order.
     */
    List<PeriodAggregate> buildDays(
            List<DayRecord> sortedDays, List<PeriodAggregate> cachedDays, int changedIndex) {
        int startIndex = changedIndex == -1 ? sortedDays.size() : changedIndex;
        startIndex = Math.min(startIndex, cachedDays.size());

        List<PeriodAggregate> days = new ArrayList<>(sortedDays.size());
        days.addAll(cachedDays.subList(0, startIndex));

        if (startIndex < sortedDays.size()) {
            RunningMedian history = RunningMedian.seededWith(numbersOf(days));
            for (int i = startIndex; i < sortedDays.size(); i++) {
                DayRecord record = sortedDays.get(i);
                PeriodAggregate prior = i > 0 ? days.get(i - 1) : null;
                List<Double> numbers = sanitize(record.dateKey(), record.numbers());
                days.add(computePeriod(record.dateKey(), TimePeriod.DAY, numbers, prior, history));
            }
        }

        count(TimePeriod.DAY, startIndex, sortedDays.size() - startIndex);
        return days;
    }

    /**
     * Buckets aggregates by the key of the coarser period containing them. Bucket contents
     * keep the input order; keys iterate in chronological order.
     */
    TreeMap<String, List<PeriodAggregate>> groupBy(List<PeriodAggregate> items, TimePeriod target) {
        TreeMap<String, List<PeriodAggregate>> buckets = new TreeMap<>();
        for (PeriodAggregate item : items) {
            try {
                String key = dateKeyService.convertKey(item.dateKey(), target);
                buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(item);
            } catch (InvalidDateKeyException e) {
                LOG.warnf("Excluding %s from %s grouping: %s", item.dateKey(), target.getLabel(), e.getMessage());
            }
        }
        return buckets;
    }

    /**
     * Builds one granularity level. Aggregates before the first container touched by the
     * change are taken from the cache; the rest are rebuilt from their children.
     *
     * @param period         granularity being built
     * @param buckets        children per container key, keys in chronological order
     * @param cached         this level's aggregates from the previous run
     * @param earliestDayKey earliest day key affected by the change, or {@code null}
     * @return aggregates aligned with the bucket keys
     */
    List<PeriodAggregate> rollUp(
            TimePeriod period,
            TreeMap<String, List<PeriodAggregate>> buckets,
            List<PeriodAggregate> cached,
            String earliestDayKey) {
        List<String> keys = new ArrayList<>(buckets.keySet());
        String earliestKey = earliestDayKey == null ? null : dateKeyService.convertKey(earliestDayKey, period);
        int boundary = findFirstKeyIndex(keys, earliestKey);

        Map<String, PeriodAggregate> cachedByKey = new HashMap<>();
        for (PeriodAggregate aggregate : cached) {
            cachedByKey.put(aggregate.dateKey(), aggregate);
        }

        List<PeriodAggregate> result = new ArrayList<>(keys.size());
        RunningMedian history = null;
        int reused = 0;
        for (int i = 0; i < keys.size(); i++) {
            String key = keys.get(i);
            PeriodAggregate previous = cachedByKey.get(key);
            if (i < boundary && previous != null) {
                result.add(previous);
                if (history != null) {
                    history.addAll(previous.numbers());
                }
                reused++;
                continue;
            }
            if (history == null) {
                history = RunningMedian.seededWith(numbersOf(result));
            }

            List<PeriodAggregate> children = buckets.get(key);
            PeriodAggregate prior = result.isEmpty() ? null : result.get(result.size() - 1);
            PeriodAggregate computed = computePeriod(key, period, flatten(children), prior, history);
            StatsExtremes extremes = extremesService.preserveIdentity(
                    previous == null ? null : previous.extremes(),
                    extremesService.calculateExtremes(children.stream().map(PeriodAggregate::stats).toList()));
            result.add(computed.withExtremes(extremes));
        }

        LOG.debugf(
                "%s level: %d keys, boundary %d (%s), %d reused",
                period.getLabel(), keys.size(), boundary, earliestKey, reused);
        count(period, reused, keys.size() - reused);
        return result;
    }

    /**
     * Index of the first key at or after {@code startKey}, or the list size when there is
     * none or {@code startKey} is {@code null}.
     */
    static int findFirstKeyIndex(List<String> keys, String startKey) {
        if (startKey == null) {
            return keys.size();
        }
        for (int i = 0; i < keys.size(); i++) {
            if (keys.get(i).compareTo(startKey) >= 0) {
                return i;
            }
        }
        return keys.size();
    }

    /**
     * The all-time aggregate over every year. It has no siblings, so its deltas and percents
     * are taken against its first value and its cumulatives equal its stats.
     */
    PeriodAggregate buildAlltime(List<PeriodAggregate> years, PeriodAggregate previous) {
        List<Double> numbers = flatten(years);
        DerivedStats derived = derivedStatsService.derive(numbers, null, null, new RunningMedian());
        StatsExtremes extremes = extremesService.preserveIdentity(
                previous == null ? null : previous.extremes(),
                extremesService.calculateExtremes(years.stream().map(PeriodAggregate::stats).toList()));
        return PeriodAggregate.of(null, TimePeriod.ANYTIME, numbers, derived).withExtremes(extremes);
    }

    private PeriodAggregate computePeriod(
            String key, TimePeriod period, List<Double> numbers, PeriodAggregate prior, RunningMedian history) {
        DerivedStats derived = derivedStatsService.derive(
                numbers,
                prior == null ? null : prior.stats(),
                prior == null ? null : prior.cumulatives(),
                history);
        return PeriodAggregate.of(key, period, numbers, derived);
    }

    /**
     * Applies the configured non-finite policy. Returns the input list itself when every
     * value is finite.
     */
    List<Double> sanitize(String dateKey, List<Double> numbers) {
        int nonFinite = 0;
        for (Double value : numbers) {
            if (!Double.isFinite(value)) {
                nonFinite++;
            }
        }
        if (nonFinite == 0) {
            return numbers;
        }

        LOG.warnf("Day %s contains %d non-finite numbers, applying policy %s", dateKey, nonFinite, nonFinitePolicy);
        if (sanitizedNumbersCounter != null) {
            sanitizedNumbersCounter.increment(nonFinite);
        }

        List<Double> sanitized = new ArrayList<>(numbers.size());
        for (Double value : numbers) {
            if (Double.isFinite(value)) {
                sanitized.add(value);
            } else if (nonFinitePolicy == NonFiniteNumberPolicy.ZERO) {
                sanitized.add(0.0);
            }
        }
        return sanitized;
    }

    private static List<Double> flatten(List<PeriodAggregate> items) {
        List<Double> numbers = new ArrayList<>();
        for (PeriodAggregate item : items) {
            numbers.addAll(item.numbers());
        }
        return numbers;
    }

    private static List<List<Double>> numbersOf(List<PeriodAggregate> items) {
        return items.stream().map(PeriodAggregate::numbers).toList();
    }

    private static AggregateSet toAggregateSet(AggregateCache cache) {
        return new AggregateSet(
                cache.sortedDays().stream().map(DayRecord::dateKey).toList(),
                keysOf(cache.weeks()),
                keysOf(cache.months()),
                keysOf(cache.years()),
                cache.days(),
                cache.weeks(),
                cache.months(),
                cache.years(),
                cache.alltime());
    }

    private static List<String> keysOf(List<PeriodAggregate> aggregates) {
        return aggregates.stream().map(PeriodAggregate::dateKey).toList();
    }

    private void count(TimePeriod period, int reused, int recomputed) {
        Counter reusedCounter = reusedCounters.get(period);
        Counter recomputedCounter = recomputedCounters.get(period);
        if (reusedCounter != null && reused > 0) {
            reusedCounter.increment(reused);
        }
        if (recomputedCounter != null && recomputed > 0) {
            recomputedCounter.increment(recomputed);
        }
    }

    private void recordDuration(long startNanos) {
        increment(recomputeCounter);
        if (recomputeTimer != null) {
            recomputeTimer.record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
        }
    }

    private static void increment(Counter counter) {
        if (counter != null) {
            counter.increment();
        }
    }
}
