package com.orderbook.engine.event;

import com.orderbook.engine.book.TraderId;
import com.orderbook.protocol.Side;

import java.math.BigInteger;

public record OrderPlaced(long orderId, TraderId owner, BigInteger baseAmount, BigInteger quoteAmount,
                          Side side, long timestamp) {}
