package com.orderbook.engine.book;

import com.orderbook.protocol.Side;

import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A resting order. Every field except the status is written once in the
 * constructor; instances are published to readers through {@link OrderStore}.
 * Fields are read directly, only the status goes through accessors.
 */
public final class Order {

    public final long       id;
    public final TraderId   owner;
    public final BigInteger baseAmount;
    public final BigInteger quoteAmount;
    public final Side       side;
    public final long       timestamp;   // epoch millis at placement

    private final AtomicReference<OrderStatus> status = new AtomicReference<>(OrderStatus.ACTIVE);

    // Guards status transitions that must be atomic across more than one order (matching)
    final Object monitor = new Object();

    Order(long id, TraderId owner, BigInteger baseAmount, BigInteger quoteAmount, Side side, long timestamp) {
        this.id = id;
        this.owner = owner;
        this.baseAmount = baseAmount;
        this.quoteAmount = quoteAmount;
        this.side = side;
        this.timestamp = timestamp;
    }

    public OrderStatus status() { return status.get(); }

    public boolean isActive() { return status.get() == OrderStatus.ACTIVE; }

    /**
     * Compare-and-transition ACTIVE -> {@code to}.
     * Returns false if the order already left ACTIVE.
     */
    boolean transition(OrderStatus to) {
        if (to == OrderStatus.ACTIVE) {
            throw new IllegalArgumentException("Orders never transition back to ACTIVE");
        }
        return status.compareAndSet(OrderStatus.ACTIVE, to);
    }

    @Override
    public String toString() {
        return "Order{" +
                "id=" + id +
                ", owner=" + owner +
                ", side=" + side +
                ", base=" + baseAmount +
                ", quote=" + quoteAmount +
                ", status=" + status.get() +
                '}';
    }
}
