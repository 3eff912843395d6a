package com.orderbook.engine.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;

/**
 * Fans notifications out to several listeners. A failing listener is logged and
 * does not keep the event from the remaining ones.
 */
public final class CompositeEventListener implements BookEventListener {

    private static final Logger log = LoggerFactory.getLogger(CompositeEventListener.class);

    private final List<BookEventListener> delegates;

    public CompositeEventListener(List<BookEventListener> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    public static BookEventListener of(List<BookEventListener> listeners) {
        if (listeners.isEmpty()) return NOOP;
        if (listeners.size() == 1) return listeners.get(0);
        return new CompositeEventListener(listeners);
    }

    @Override
    public void onOrderPlaced(OrderPlaced event) {
        forEach(l -> l.onOrderPlaced(event));
    }

    @Override
    public void onOrderCancelled(OrderCancelled event) {
        forEach(l -> l.onOrderCancelled(event));
    }

    @Override
    public void onOrderMatched(OrderMatched event) {
        forEach(l -> l.onOrderMatched(event));
    }

    @Override
    public void onOrdersProcessed(OrdersProcessed event) {
        forEach(l -> l.onOrdersProcessed(event));
    }

    private void forEach(Consumer<BookEventListener> call) {
        for (BookEventListener l : delegates) {
            try {
                call.accept(l);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed", l.getClass().getSimpleName(), e);
            }
        }
    }
}
