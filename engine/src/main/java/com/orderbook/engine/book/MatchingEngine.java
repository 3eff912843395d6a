package com.orderbook.engine.book;

import com.orderbook.protocol.Side;

import java.util.Objects;

/**
 * Pairwise exact-amount matcher.
 *
 * A pair (buyId, sellId) matches when both orders are ACTIVE, the first is a BUY,
 *   buy.quoteAmount >= sell.baseAmount  and  buy.baseAmount == sell.baseAmount.
 * The side of the second order is not checked.
 *
 * On a match the buyer is credited sell.baseAmount, the seller buy.quoteAmount,
 * and both orders move to MATCHED. Any failed check leaves everything untouched.
 *
 * Both orders' monitors are taken in ascending id order, so matches over disjoint
 * ids never contend and overlapping ones cannot deadlock. Cancellation goes
 * through the same monitor ({@link OrderStore#invalidate}), which makes a
 * cancel racing a match resolve to exactly one winner.
 */
public final class MatchingEngine {

    public interface MatchCallback {
        /**
         * Called once per successful match, after both orders are MATCHED.
         * @param buy          order at the buy position of the pair
         * @param sell         order at the sell position of the pair
         */
        void onMatch(Order buy, Order sell);
    }

    private static final MatchCallback NO_CALLBACK = (buy, sell) -> { };

    private final OrderStore store;
    private final TraderLedger ledger;

    public MatchingEngine(OrderStore store, TraderLedger ledger) {
        this.store = Objects.requireNonNull(store, "store");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
    }

    public boolean tryMatch(long buyId, long sellId) {
        return tryMatch(buyId, sellId, NO_CALLBACK);
    }

    public boolean tryMatch(long buyId, long sellId, MatchCallback cb) {
        if (buyId == sellId) return false; // a match needs two distinct orders

        Order buy = store.get(buyId).orElse(null);
        Order sell = store.get(sellId).orElse(null);
        if (buy == null || sell == null) return false;
        if (!isCompatible(buy, sell)) return false;

        Order first  = buy.id < sell.id ? buy : sell;
        Order second = buy.id < sell.id ? sell : buy;
        synchronized (first.monitor) {
            synchronized (second.monitor) {
                // Status may have moved while we were acquiring
                if (!buy.isActive() || !sell.isActive()) return false;

                buy.transition(OrderStatus.MATCHED);
                sell.transition(OrderStatus.MATCHED);
                ledger.credit(buy.owner, sell.baseAmount);
                ledger.credit(sell.owner, buy.quoteAmount);
            }
        }
        cb.onMatch(buy, sell);
        return true;
    }

    /** Read-only pre-check of the pair; amounts and sides are immutable. */
    static boolean isCompatible(Order buy, Order sell) {
        if (!buy.isActive() || !sell.isActive()) return false;
        if (buy.side != Side.BUY) return false;
        return buy.quoteAmount.compareTo(sell.baseAmount) >= 0
                && buy.baseAmount.equals(sell.baseAmount);
    }
}
