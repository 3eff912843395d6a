package com.orderbook.engine.book;

import com.orderbook.engine.OrderBookException;
import com.orderbook.protocol.Messages;
import com.orderbook.protocol.RejectReason;
import com.orderbook.protocol.Side;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Authoritative id -> {@link Order} mapping.
 *
 * Records are never removed: a cancelled or matched order stays queryable in its
 * terminal state. Ids come from the {@link IdentifierAllocator} handed in by the
 * owner of the store, and are drawn only once the amounts have been validated, so
 * a rejected placement never consumes an id.
 */
public final class OrderStore {

    private final IdentifierAllocator ids;
    private final ConcurrentHashMap<Long, Order> orders;

    public OrderStore(IdentifierAllocator ids, int initialCapacity) {
        this.ids = Objects.requireNonNull(ids, "ids");
        this.orders = new ConcurrentHashMap<>(Math.max(16, initialCapacity));
    }

    /**
     * Store a new ACTIVE order and return its id.
     *
     * @throws OrderBookException {@link RejectReason#INVALID_AMOUNT} if either amount is
     *         missing, not positive, or wider than 256 bits
     */
    public long create(TraderId owner, BigInteger baseAmount, BigInteger quoteAmount, Side side, long timestamp) {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(side, "side");
        if (!isValidAmount(baseAmount) || !isValidAmount(quoteAmount)) {
            throw new OrderBookException(RejectReason.INVALID_AMOUNT,
                    "base=" + baseAmount + " quote=" + quoteAmount);
        }
        long id = ids.next();
        orders.put(id, new Order(id, owner, baseAmount, quoteAmount, side, timestamp));
        return id;
    }

    /** The stored record in any status, or empty if the id was never issued. */
    public Optional<Order> get(long id) {
        return Optional.ofNullable(orders.get(id));
    }

    /**
     * Move an ACTIVE order to {@code newStatus}. No authorization is performed here.
     * Returns false, without error, if the id is unknown or the order already left ACTIVE.
     */
    public boolean invalidate(long id, OrderStatus newStatus) {
        Order order = orders.get(id);
        if (order == null) return false;
        synchronized (order.monitor) {
            return order.transition(newStatus);
        }
    }

    public int size() {
        return orders.size();
    }

    public static boolean isValidAmount(BigInteger amount) {
        return amount != null
                && amount.signum() > 0
                && amount.compareTo(Messages.MAX_UINT256) <= 0;
    }
}
