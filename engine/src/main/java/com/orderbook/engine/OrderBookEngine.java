package com.orderbook.engine;

import com.orderbook.common.BookConfig;
import com.orderbook.common.LatencyStats;
import com.orderbook.engine.book.IdentifierAllocator;
import com.orderbook.engine.book.MatchingEngine;
import com.orderbook.engine.book.Order;
import com.orderbook.engine.book.OrderStatus;
import com.orderbook.engine.book.OrderStore;
import com.orderbook.engine.book.TraderId;
import com.orderbook.engine.book.TraderLedger;
import com.orderbook.engine.book.TraderStats;
import com.orderbook.engine.event.BookEventListener;
import com.orderbook.engine.event.CompositeEventListener;
import com.orderbook.engine.event.LoggingEventListener;
import com.orderbook.engine.event.OrderCancelled;
import com.orderbook.engine.event.OrderMatched;
import com.orderbook.engine.event.OrderPlaced;
import com.orderbook.engine.event.OrdersProcessed;
import com.orderbook.engine.stats.BookStats;
import com.orderbook.engine.stats.PeriodicStatsReporter;
import com.orderbook.engine.stats.StatsAggregator;
import com.orderbook.protocol.Messages;
import com.orderbook.protocol.RejectReason;
import com.orderbook.protocol.Side;
import org.agrona.concurrent.EpochClock;
import org.agrona.concurrent.SystemEpochClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Entry point of the book: placement, cancellation, batched matching and reads.
 *
 * Safe for any number of concurrent callers. There is no book-wide lock: the id
 * counter, each order's status, each trader's ledger entry and each aggregate
 * counter are updated independently, so operations on disjoint orders never wait
 * on each other. Operations that share an order resolve so that exactly one wins.
 *
 * Usage:
 * <pre>
 *   try (OrderBookEngine book = OrderBookEngine.create(BookConfig.load(path))) {
 *       long id = book.placeOrder(trader, base, quote, Side.BUY);
 *       ...
 *   }
 * </pre>
 */
public final class OrderBookEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OrderBookEngine.class);

    private final BookConfig cfg;
    private final EpochClock clock;
    private final BookEventListener listener;

    private final IdentifierAllocator ids = new IdentifierAllocator();
    private final OrderStore store;
    private final TraderLedger ledger = new TraderLedger();
    private final MatchingEngine matcher;
    private final StatsAggregator stats = new StatsAggregator();

    private final LatencyStats placeLatency  = new LatencyStats("placeOrder");
    private final LatencyStats cancelLatency = new LatencyStats("cancelOrder");
    private final LatencyStats matchLatency  = new LatencyStats("matchOrdersBatch");

    private PeriodicStatsReporter reporter;

    public OrderBookEngine(BookConfig cfg, EpochClock clock, BookEventListener listener) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.store = new OrderStore(ids, cfg.initialOrderCapacity);
        this.matcher = new MatchingEngine(store, ledger);
    }

    /**
     * Builds and starts an engine on the system clock. A logging listener is
     * attached ahead of {@code observers} when {@code cfg.logEvents} is set.
     */
    public static OrderBookEngine create(BookConfig cfg, BookEventListener... observers) {
        List<BookEventListener> listeners = new ArrayList<>();
        if (cfg.logEvents) listeners.add(new LoggingEventListener());
        listeners.addAll(List.of(observers));
        OrderBookEngine engine = new OrderBookEngine(cfg, SystemEpochClock.INSTANCE, CompositeEventListener.of(listeners));
        engine.start();
        return engine;
    }

    /** Starts periodic stats reporting if configured. */
    public synchronized void start() {
        if (reporter != null || cfg.statsIntervalSecs <= 0) return;
        reporter = new PeriodicStatsReporter(stats, List.of(placeLatency, cancelLatency, matchLatency),
                cfg.statsIntervalSecs);
        reporter.start();
        log.info("Order book started: {}", cfg);
    }

    @Override
    public synchronized void close() {
        if (reporter != null) {
            reporter.stop();
            reporter.logShutdownSummary();
            reporter = null;
        }
    }

    // ---- Mutations ----

    /**
     * Place a new ACTIVE order.
     *
     * @return the order id (never 0)
     * @throws OrderBookException {@link RejectReason#INVALID_AMOUNT} if either amount is
     *         zero, negative, missing or wider than 256 bits
     */
    public long placeOrder(TraderId owner, BigInteger baseAmount, BigInteger quoteAmount, Side side) {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(side, "side");
        long start = System.nanoTime();
        long now = clock.time();
        long id;
        try {
            id = store.create(owner, baseAmount, quoteAmount, side, now);
        } catch (OrderBookException e) {
            log.debug("placeOrder rejected owner={} reason={}", owner, e.reason());
            throw e;
        }
        ledger.recordOrderPlaced(owner);
        stats.recordPlaced();
        track(placeLatency, start);

        emit(l -> l.onOrderPlaced(new OrderPlaced(id, owner, baseAmount, quoteAmount, side, now)));
        return id;
    }

    /** Cancel with the configured default reason. */
    public void cancelOrder(TraderId caller, long orderId) {
        cancelOrder(caller, orderId, cfg.defaultCancelReason);
    }

    /**
     * Cancel an ACTIVE order on behalf of its owner.
     *
     * @throws OrderBookException {@link RejectReason#ORDER_NOT_FOUND} if the id was never
     *         issued or the order is no longer ACTIVE; {@link RejectReason#UNAUTHORIZED}
     *         if {@code caller} is not the owner
     */
    public void cancelOrder(TraderId caller, long orderId, String reason) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(reason, "reason");
        if (reason.getBytes(StandardCharsets.UTF_8).length > Messages.MAX_REASON_BYTES) {
            throw new IllegalArgumentException("Cancel reason exceeds " + Messages.MAX_REASON_BYTES + " bytes");
        }
        long start = System.nanoTime();

        Order order = store.get(orderId).filter(Order::isActive).orElse(null);
        if (order == null) {
            throw reject(RejectReason.ORDER_NOT_FOUND, orderId, "no active order " + orderId);
        }
        if (!order.owner.equals(caller)) {
            throw reject(RejectReason.UNAUTHORIZED, orderId, caller + " does not own order " + orderId);
        }
        // Lost a race with another cancel or a match
        if (!store.invalidate(orderId, OrderStatus.CANCELLED)) {
            throw reject(RejectReason.ORDER_NOT_FOUND, orderId, "order " + orderId + " is no longer active");
        }
        stats.recordCancelled();
        track(cancelLatency, start);

        long now = clock.time();
        emit(l -> l.onOrderCancelled(new OrderCancelled(orderId, order.owner, reason, now)));
    }

    /**
     * Match {@code buyIds[i]} against {@code sellIds[i]} for every i. Pairs that are
     * incompatible or reference missing / inactive orders are skipped.
     *
     * @return number of pairs that matched
     * @throws OrderBookException {@link RejectReason#INVALID_BATCH_SIZE} if the arrays
     *         differ in length
     */
    public int matchOrdersBatch(long[] buyIds, long[] sellIds) {
        Objects.requireNonNull(buyIds, "buyIds");
        Objects.requireNonNull(sellIds, "sellIds");
        if (buyIds.length != sellIds.length) {
            throw reject(RejectReason.INVALID_BATCH_SIZE, 0L,
                    "buyIds=" + buyIds.length + " sellIds=" + sellIds.length);
        }
        long start = System.nanoTime();

        int matchCount = 0;
        for (int i = 0; i < buyIds.length; i++) {
            if (matcher.tryMatch(buyIds[i], sellIds[i], this::onMatched)) {
                matchCount++;
            }
        }
        stats.recordMatched(matchCount);
        track(matchLatency, start);

        int matched = matchCount;
        long now = clock.time();
        emit(l -> l.onOrdersProcessed(new OrdersProcessed(buyIds.length, matched, now)));
        return matchCount;
    }

    private void onMatched(Order buy, Order sell) {
        OrderMatched event = new OrderMatched(buy.id, sell.id, buy.owner, sell.owner,
                sell.baseAmount, buy.quoteAmount, clock.time());
        emit(l -> l.onOrderMatched(event));
    }

    // ---- Reads ----

    public OrderView getOrder(long orderId) {
        return store.get(orderId).map(OrderView::of).orElse(OrderView.NOT_FOUND);
    }

    /** Full record including status, for auditing terminal orders. */
    public Optional<Order> findOrder(long orderId) {
        return store.get(orderId);
    }

    public boolean orderExists(long orderId) {
        return store.get(orderId).map(Order::isActive).orElse(false);
    }

    /** Number of ids issued so far; equals the number of successful placements. */
    public long getOrderCount() {
        return ids.current();
    }

    public TraderStats getTraderStats(TraderId owner) {
        return ledger.stats(Objects.requireNonNull(owner, "owner"));
    }

    public BookStats getOrderBookStats() {
        return stats.snapshot();
    }

    // ---- Helpers ----

    private OrderBookException reject(RejectReason reason, long orderId, String message) {
        log.debug("Rejected {} order={}: {}", reason, orderId, message);
        return new OrderBookException(reason, orderId, message);
    }

    private void track(LatencyStats latency, long startNanos) {
        if (cfg.trackLatency) latency.record(System.nanoTime() - startNanos);
    }

    private void emit(Consumer<BookEventListener> call) {
        try {
            call.accept(listener);
        } catch (RuntimeException e) {
            log.warn("Event listener failed", e);
        }
    }
}
