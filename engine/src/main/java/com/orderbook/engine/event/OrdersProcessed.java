package com.orderbook.engine.event;

/** Summary of one {@code matchOrdersBatch} call. */
public record OrdersProcessed(int pairsSubmitted, int matchCount, long timestamp) {}
