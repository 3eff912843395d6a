package com.orderbook.engine.stats;

/**
 * Point-in-time view of the book-wide counters. {@code totalMatched} counts pairs.
 */
public record BookStats(long totalPlaced, long totalMatched, long totalCancelled) {}
