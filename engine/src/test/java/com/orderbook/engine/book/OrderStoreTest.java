package com.orderbook.engine.book;

import com.orderbook.engine.OrderBookException;
import com.orderbook.protocol.Messages;
import com.orderbook.protocol.RejectReason;
import com.orderbook.protocol.Side;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class OrderStoreTest {

    private static final TraderId ALICE = TraderId.of("alice");

    private IdentifierAllocator ids;
    private OrderStore store;

    @BeforeEach
    void setUp() {
        ids = new IdentifierAllocator();
        store = new OrderStore(ids, 16);
    }

    @Test
    void testCreateStoresActiveRecord() {
        long id = store.create(ALICE, big(100), big(200), Side.BUY, 1234L);

        assertEquals(1, id);
        Order o = store.get(id).orElseThrow();
        assertEquals(ALICE, o.owner);
        assertEquals(big(100), o.baseAmount);
        assertEquals(big(200), o.quoteAmount);
        assertEquals(Side.BUY, o.side);
        assertEquals(1234L, o.timestamp);
        assertEquals(OrderStatus.ACTIVE, o.status());
    }

    // -----------------------------------------------------------------------
    // Rejected amounts never consume an id
    // -----------------------------------------------------------------------
    @Test
    void testInvalidAmountsRejectedBeforeAllocation() {
        assertInvalid(BigInteger.ZERO, big(1));
        assertInvalid(big(1), BigInteger.ZERO);
        assertInvalid(big(-5), big(1));
        assertInvalid(null, big(1));
        assertInvalid(big(1), Messages.MAX_UINT256.add(BigInteger.ONE));

        assertEquals(0, ids.current(), "no id consumed by failed creates");
        assertEquals(0, store.size());

        long id = store.create(ALICE, Messages.MAX_UINT256, big(1), Side.SELL, 0L);
        assertEquals(1, id, "first successful create gets id 1");
    }

    @Test
    void testGetUnknownIdIsEmpty() {
        assertTrue(store.get(0).isEmpty(), "0 is the not-found sentinel");
        assertTrue(store.get(42).isEmpty());
    }

    @Test
    void testInvalidateIsOneShot() {
        long id = store.create(ALICE, big(1), big(1), Side.SELL, 0L);

        assertTrue(store.invalidate(id, OrderStatus.CANCELLED));
        assertFalse(store.invalidate(id, OrderStatus.CANCELLED), "second invalidate is a no-op");
        assertFalse(store.invalidate(id, OrderStatus.MATCHED));
        assertEquals(OrderStatus.CANCELLED, store.get(id).orElseThrow().status(), "record retained");
        assertFalse(store.invalidate(99, OrderStatus.CANCELLED), "unknown id");
    }

    @Test
    void testInvalidateNeverReactivates() {
        long id = store.create(ALICE, big(1), big(1), Side.SELL, 0L);
        assertThrows(IllegalArgumentException.class, () -> store.invalidate(id, OrderStatus.ACTIVE));
        assertTrue(store.get(id).orElseThrow().isActive());
    }

    private void assertInvalid(BigInteger base, BigInteger quote) {
        OrderBookException e = assertThrows(OrderBookException.class,
                () -> store.create(ALICE, base, quote, Side.BUY, 0L));
        assertEquals(RejectReason.INVALID_AMOUNT, e.reason());
    }

    private static BigInteger big(long v) {
        return BigInteger.valueOf(v);
    }
}
