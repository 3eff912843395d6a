package com.orderbook.engine.book;

/**
 * Order lifecycle. ACTIVE is the only non-terminal state.
 */
public enum OrderStatus {
    ACTIVE,
    CANCELLED,
    MATCHED;

    public boolean isTerminal() { return this != ACTIVE; }
}
