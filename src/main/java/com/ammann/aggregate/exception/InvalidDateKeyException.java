/* (C)2026 */
package com.ammann.aggregate.exception;

import com.ammann.aggregate.enumeration.TimePeriod;

/**
 * Exception indicating that a date key does not have the shape its granularity requires,
 * or names a date that does not exist.
 */
public class InvalidDateKeyException extends AggregationException {

    private final String key;

    public InvalidDateKeyException(String key, String message) {
        super(message);
        this.key = key;
    }

    public InvalidDateKeyException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    /**
     * Creates exception for a key that is not a valid key of the expected granularity.
     */
    public static InvalidDateKeyException malformed(String key, TimePeriod expected) {
        return new InvalidDateKeyException(
                key, String.format("Invalid %s key '%s'", expected.getLabel(), key));
    }

    /**
     * Creates exception for a key that matches no granularity at all.
     */
    public static InvalidDateKeyException unrecognized(String key) {
        return new InvalidDateKeyException(key, String.format("Unrecognized date key '%s'", key));
    }

    /**
     * Creates exception for a conversion that has no coarser target.
     */
    public static InvalidDateKeyException unsupportedConversion(
            String key, TimePeriod source, TimePeriod target) {
        return new InvalidDateKeyException(
                key,
                String.format(
                        "Cannot convert %s key '%s' to %s",
                        source.getLabel(), key, target.getLabel()));
    }

    public String getKey() {
        return key;
    }
}
