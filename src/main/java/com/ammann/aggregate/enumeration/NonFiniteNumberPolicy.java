/* (C)2026 */
package com.ammann.aggregate.enumeration;

/**
 * How NaN and infinite values in a day record are treated before any statistic sees them.
 *
 * <p>Configured via {@code aggregate.numbers.non-finite-policy}.
 */
public enum NonFiniteNumberPolicy {
    /** Drop the value; the day's count does not include it. */
    SKIP,
    /** Replace the value with {@code 0}; the day's count includes it. */
    ZERO
}
