/* (C)2026 */
package com.ammann.aggregate.exception;

/**
 * Base unchecked exception for all errors raised by the period aggregation engine.
 *
 * <p>Subclasses represent specific error categories. The recompute engine handles them
 * locally and degrades to a partial view instead of failing the whole run.
 */
public class AggregationException extends RuntimeException {

    public AggregationException(String message, Throwable cause) {
        super(message, cause);
    }

    public AggregationException(String message) {
        super(message);
    }
}
