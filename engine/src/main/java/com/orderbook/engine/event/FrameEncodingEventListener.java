package com.orderbook.engine.event;

import com.orderbook.protocol.Messages;
import org.agrona.ExpandableArrayBuffer;

import java.util.Objects;

/**
 * Encodes notifications into binary frames (see {@link Messages}) and hands them
 * to a {@link FrameSink}. Each calling thread encodes into its own buffer, so no
 * allocation per event beyond the amount byte arrays.
 */
public final class FrameEncodingEventListener implements BookEventListener {

    private static final int INITIAL_BUFFER_SIZE = 512;

    private final FrameSink sink;
    private final ThreadLocal<ExpandableArrayBuffer> buffers =
            ThreadLocal.withInitial(() -> new ExpandableArrayBuffer(INITIAL_BUFFER_SIZE));

    public FrameEncodingEventListener(FrameSink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public void onOrderPlaced(OrderPlaced e) {
        ExpandableArrayBuffer buf = buffers.get();
        int len = Messages.encodeOrderPlaced(buf, 0, e.orderId(), e.timestamp(), e.side(),
                e.baseAmount(), e.quoteAmount(), e.owner().value());
        sink.onFrame(buf, 0, len);
    }

    @Override
    public void onOrderCancelled(OrderCancelled e) {
        ExpandableArrayBuffer buf = buffers.get();
        int len = Messages.encodeOrderCancelled(buf, 0, e.orderId(), e.timestamp(),
                e.owner().value(), e.reason());
        sink.onFrame(buf, 0, len);
    }

    @Override
    public void onOrderMatched(OrderMatched e) {
        ExpandableArrayBuffer buf = buffers.get();
        int len = Messages.encodeOrderMatched(buf, 0, e.buyOrderId(), e.sellOrderId(), e.timestamp(),
                e.buyerCredit(), e.sellerCredit(), e.buyer().value(), e.seller().value());
        sink.onFrame(buf, 0, len);
    }

    @Override
    public void onOrdersProcessed(OrdersProcessed e) {
        ExpandableArrayBuffer buf = buffers.get();
        int len = Messages.encodeOrdersProcessed(buf, 0, e.pairsSubmitted(), e.matchCount(), e.timestamp());
        sink.onFrame(buf, 0, len);
    }
}
