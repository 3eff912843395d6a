package com.orderbook.engine;

import com.orderbook.protocol.RejectReason;

/**
 * Synchronous failure of a single book operation. The book's state is unchanged
 * when this is thrown.
 */
public final class OrderBookException extends RuntimeException {

    private final RejectReason reason;
    private final long orderId;

    public OrderBookException(RejectReason reason, String message) {
        this(reason, 0L, message);
    }

    public OrderBookException(RejectReason reason, long orderId, String message) {
        super(reason + ": " + message);
        this.reason = reason;
        this.orderId = orderId;
    }

    public RejectReason reason() { return reason; }

    /** Order the failure refers to, 0 when none. */
    public long orderId() { return orderId; }
}
