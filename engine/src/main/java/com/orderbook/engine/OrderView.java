package com.orderbook.engine;

import com.orderbook.engine.book.Order;
import com.orderbook.engine.book.TraderId;

import java.math.BigInteger;

/**
 * Read model returned by {@link OrderBookEngine#getOrder(long)}.
 *
 * {@code exists} is true only while the order is ACTIVE. Cancelled and matched
 * orders keep their fields; an id that was never issued yields {@link #NOT_FOUND}
 * (null owner, zero amounts).
 */
public record OrderView(TraderId owner, BigInteger baseAmount, BigInteger quoteAmount,
                        long timestamp, boolean isBuy, boolean exists) {

    public static final OrderView NOT_FOUND =
            new OrderView(null, BigInteger.ZERO, BigInteger.ZERO, 0L, false, false);

    static OrderView of(Order o) {
        return new OrderView(o.owner, o.baseAmount, o.quoteAmount, o.timestamp, o.side.isBuy(), o.isActive());
    }
}
