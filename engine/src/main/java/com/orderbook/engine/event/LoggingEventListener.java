package com.orderbook.engine.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes notifications to the log: per-order events at DEBUG, batch summaries at INFO.
 */
public final class LoggingEventListener implements BookEventListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingEventListener.class);

    @Override
    public void onOrderPlaced(OrderPlaced e) {
        log.debug("OrderPlaced id={} owner={} side={} base={} quote={}",
                e.orderId(), e.owner(), e.side(), e.baseAmount(), e.quoteAmount());
    }

    @Override
    public void onOrderCancelled(OrderCancelled e) {
        log.debug("OrderCancelled id={} owner={} reason={}", e.orderId(), e.owner(), e.reason());
    }

    @Override
    public void onOrderMatched(OrderMatched e) {
        log.debug("OrderMatched buy={} sell={} buyer={} (+{}) seller={} (+{})",
                e.buyOrderId(), e.sellOrderId(), e.buyer(), e.buyerCredit(), e.seller(), e.sellerCredit());
    }

    @Override
    public void onOrdersProcessed(OrdersProcessed e) {
        log.info("OrdersProcessed pairs={} matched={}", e.pairsSubmitted(), e.matchCount());
    }
}
