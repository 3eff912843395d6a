package com.orderbook.engine.book;

import java.math.BigInteger;

/**
 * Per-trader bookkeeping snapshot.
 *
 * @param orderCount     orders ever placed by the trader
 * @param settledBalance credits accumulated from matches
 */
public record TraderStats(long orderCount, BigInteger settledBalance) {

    public static final TraderStats EMPTY = new TraderStats(0, BigInteger.ZERO);
}
