package com.orderbook.engine.event;

import com.orderbook.engine.book.TraderId;

import java.math.BigInteger;

/**
 * One successful pair of a batch.
 *
 * @param buyerCredit  amount credited to the buyer (the sell order's base amount)
 * @param sellerCredit amount credited to the seller (the buy order's quote amount)
 */
public record OrderMatched(long buyOrderId, long sellOrderId, TraderId buyer, TraderId seller,
                           BigInteger buyerCredit, BigInteger sellerCredit, long timestamp) {}
