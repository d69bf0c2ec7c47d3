/* (C)2026 */
package com.ammann.aggregate.model;

/**
 * Output of one recompute run: the aggregates to publish and the cache to pass into the
 * next run.
 */
public record AggregationResult(AggregateSet aggregates, AggregateCache cache) {}
