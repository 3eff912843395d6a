package com.orderbook.engine.event;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CompositeEventListenerTest {

    @Test
    void testFailingDelegateDoesNotStarveOthers() {
        List<OrdersProcessed> seen = new ArrayList<>();
        BookEventListener failing = new BookEventListener() {
            @Override
            public void onOrdersProcessed(OrdersProcessed event) {
                throw new IllegalStateException("observer down");
            }
        };
        BookEventListener recording = new BookEventListener() {
            @Override
            public void onOrdersProcessed(OrdersProcessed event) {
                seen.add(event);
            }
        };

        BookEventListener composite = CompositeEventListener.of(List.of(failing, recording));
        composite.onOrdersProcessed(new OrdersProcessed(1, 0, 0L));

        assertEquals(1, seen.size());
    }

    @Test
    void testTrivialCompositions() {
        assertSame(BookEventListener.NOOP, CompositeEventListener.of(List.of()));
        BookEventListener single = new LoggingEventListener();
        assertSame(single, CompositeEventListener.of(List.of(single)));
    }
}
