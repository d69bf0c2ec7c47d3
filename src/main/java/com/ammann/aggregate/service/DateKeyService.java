/* (C)2026 */
package com.ammann.aggregate.service;

import com.ammann.aggregate.enumeration.TimePeriod;
import com.ammann.aggregate.exception.InvalidDateKeyException;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.util.regex.Pattern;

/**
 * Parses, builds and converts date keys of every granularity.
 *
 * <p>Key formats:
 * <ul>
 *   <li>day: {@code yyyy-MM-dd}</li>
 *   <li>week: {@code yyyy-'W'ww}, ISO-8601 week-based year and week number</li>
 *   <li>month: {@code yyyy-MM}</li>
 *   <li>year: {@code yyyy}</li>
 * </ul>
 *
 * <p>All formats are zero-padded, so comparing two keys of the same granularity as strings
 * gives the same order as comparing the periods chronologically.
 */
@ApplicationScoped
public class DateKeyService {

    private static final Pattern DAY_KEY = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern WEEK_KEY = Pattern.compile("^\\d{4}-W\\d{2}$");
    private static final Pattern MONTH_KEY = Pattern.compile("^\\d{4}-\\d{2}$");
    private static final Pattern YEAR_KEY = Pattern.compile("^\\d{4}$");

    public boolean isDayKey(String key) {
        return key != null && DAY_KEY.matcher(key).matches() && tryParseDay(key) != null;
    }

    public boolean isWeekKey(String key) {
        if (key == null || !WEEK_KEY.matcher(key).matches()) {
            return false;
        }
        int year = Integer.parseInt(key.substring(0, 4));
        int week = Integer.parseInt(key.substring(6));
        return week >= 1 && week <= weeksInWeekBasedYear(year);
    }

    public boolean isMonthKey(String key) {
        if (key == null || !MONTH_KEY.matcher(key).matches()) {
            return false;
        }
        int month = Integer.parseInt(key.substring(5));
        return month >= 1 && month <= 12;
    }

    public boolean isYearKey(String key) {
        return key != null && YEAR_KEY.matcher(key).matches();
    }

    /**
     * Checks that a key is a day key naming an existing date.
     *
     * @return the key itself
     * @throws InvalidDateKeyException if the key is not a valid day key
     */
    public String requireDayKey(String key) {
        if (!isDayKey(key)) {
            throw InvalidDateKeyException.malformed(key, TimePeriod.DAY);
        }
        return key;
    }

    /**
     * Returns the granularity a key belongs to.
     *
     * @throws InvalidDateKeyException if the key matches no granularity
     */
    public TimePeriod periodOf(String key) {
        if (isDayKey(key)) return TimePeriod.DAY;
        if (isWeekKey(key)) return TimePeriod.WEEK;
        if (isMonthKey(key)) return TimePeriod.MONTH;
        if (isYearKey(key)) return TimePeriod.YEAR;
        throw InvalidDateKeyException.unrecognized(key);
    }

    /**
     * Converts a key to the key of the coarser period containing it.
     *
     * <p>Day keys convert to every granularity, month keys to month and year, and every key
     * converts to its own granularity unchanged.
     *
     * @param key    day, week, month or year key
     * @param target granularity to convert to
     * @return the containing period's key
     * @throws InvalidDateKeyException if the key is malformed or the conversion would go
     *                                 from a coarser to a finer granularity
     */
    public String convertKey(String key, TimePeriod target) {
        TimePeriod source = periodOf(key);
        if (source == target) {
            return key;
        }
        if (source == TimePeriod.DAY) {
            LocalDate date = parseDay(key);
            return switch (target) {
                case WEEK -> toWeekKey(
                        date.get(IsoFields.WEEK_BASED_YEAR),
                        date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
                case MONTH -> toMonthKey(date.getYear(), date.getMonthValue());
                case YEAR -> toYearKey(date.getYear());
                default -> throw InvalidDateKeyException.unsupportedConversion(key, source, target);
            };
        }
        if (source == TimePeriod.MONTH && target == TimePeriod.YEAR) {
            return key.substring(0, 4);
        }
        throw InvalidDateKeyException.unsupportedConversion(key, source, target);
    }

    /**
     * Returns the first day of the period a key names: the date itself for a day, the
     * Monday of an ISO week, the first of a month, or January 1st of a year.
     *
     * @throws InvalidDateKeyException if the key matches no granularity
     */
    public LocalDate parseDateKey(String key) {
        return switch (periodOf(key)) {
            case DAY -> parseDay(key);
            case WEEK -> LocalDate.of(Integer.parseInt(key.substring(0, 4)), 1, 4)
                    .with(IsoFields.WEEK_OF_WEEK_BASED_YEAR, Integer.parseInt(key.substring(6)))
                    .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTH -> LocalDate.of(
                    Integer.parseInt(key.substring(0, 4)), Integer.parseInt(key.substring(5)), 1);
            default -> LocalDate.of(Integer.parseInt(key), 1, 1);
        };
    }

    public String toDayKey(int year, int month, int day) {
        return String.format("%04d-%02d-%02d", year, month, day);
    }

    public String toDayKey(LocalDate date) {
        return toDayKey(date.getYear(), date.getMonthValue(), date.getDayOfMonth());
    }

    public String toWeekKey(int weekBasedYear, int week) {
        return String.format("%04d-W%02d", weekBasedYear, week);
    }

    public String toMonthKey(int year, int month) {
        return String.format("%04d-%02d", year, month);
    }

    public String toYearKey(int year) {
        return String.format("%04d", year);
    }

    private LocalDate parseDay(String key) {
        LocalDate date = tryParseDay(key);
        if (date == null) {
            throw InvalidDateKeyException.malformed(key, TimePeriod.DAY);
        }
        return date;
    }

    private static LocalDate tryParseDay(String key) {
        try {
            return LocalDate.of(
                    Integer.parseInt(key.substring(0, 4)),
                    Integer.parseInt(key.substring(5, 7)),
                    Integer.parseInt(key.substring(8, 10)));
        } catch (DateTimeException | NumberFormatException | IndexOutOfBoundsException e) {
            return null;
        }
    }

    private static int weeksInWeekBasedYear(int year) {
        // December 28th always falls in the last ISO week of its week-based year.
        return LocalDate.of(year, 12, 28).get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
    }
}
