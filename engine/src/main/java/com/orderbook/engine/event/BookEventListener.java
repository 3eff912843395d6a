package com.orderbook.engine.event;

/**
 * One-way observer of book notifications. Callbacks run on the calling thread of
 * the operation that produced them, after its state change is visible, and may
 * be invoked concurrently. Exceptions thrown here are logged and never fail the
 * operation.
 */
public interface BookEventListener {

    BookEventListener NOOP = new BookEventListener() { };

    default void onOrderPlaced(OrderPlaced event) { }

    default void onOrderCancelled(OrderCancelled event) { }

    default void onOrderMatched(OrderMatched event) { }

    default void onOrdersProcessed(OrdersProcessed event) { }
}
