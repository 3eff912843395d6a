package com.orderbook.engine.book;

import java.math.BigInteger;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-trader order counts and settled balances. Both only grow.
 * Entries are created on first write; reads of unknown traders do not create one.
 */
public final class TraderLedger {

    private static final class Account {
        final AtomicLong orderCount = new AtomicLong();
        final AtomicReference<BigInteger> balance = new AtomicReference<>(BigInteger.ZERO);
    }

    private final ConcurrentHashMap<TraderId, Account> accounts = new ConcurrentHashMap<>();

    public void recordOrderPlaced(TraderId trader) {
        account(trader).orderCount.incrementAndGet();
    }

    public void credit(TraderId trader, BigInteger amount) {
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Credit must not be negative: " + amount);
        }
        account(trader).balance.accumulateAndGet(amount, BigInteger::add);
    }

    public TraderStats stats(TraderId trader) {
        Account a = accounts.get(trader);
        if (a == null) return TraderStats.EMPTY;
        return new TraderStats(a.orderCount.get(), a.balance.get());
    }

    public int traderCount() {
        return accounts.size();
    }

    private Account account(TraderId trader) {
        return accounts.computeIfAbsent(trader, t -> new Account());
    }
}
