package com.orderbook.engine.event;

import com.orderbook.engine.book.TraderId;
import com.orderbook.protocol.Messages;
import com.orderbook.protocol.MsgType;
import com.orderbook.protocol.Side;
import org.agrona.concurrent.UnsafeBuffer;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FrameEncodingEventListenerTest {

    private static final TraderId ALICE = TraderId.of("alice");
    private static final TraderId BOB   = TraderId.of("bob");

    // Frames are copied out: the listener's buffer is reused
    private final List<UnsafeBuffer> frames = new ArrayList<>();

    private final FrameEncodingEventListener listener = new FrameEncodingEventListener((buffer, offset, length) -> {
        byte[] copy = new byte[length];
        buffer.getBytes(offset, copy);
        frames.add(new UnsafeBuffer(copy));
    });

    @Test
    void testPlacedFrame() {
        listener.onOrderPlaced(new OrderPlaced(5L, ALICE, BigInteger.valueOf(100), BigInteger.valueOf(200), Side.BUY, 77L));

        UnsafeBuffer f = frames.get(0);
        assertEquals(MsgType.ORDER_PLACED, Messages.readFrameType(f, 0));
        assertEquals(f.capacity() - 2, Messages.readFrameLength(f, 0));
        int p = Messages.FRAME_HEADER_SIZE;
        assertEquals(5L, Messages.getLong(f, p + Messages.PLACED_ORDER_ID_OFFSET));
        assertEquals(77L, Messages.getLong(f, p + Messages.PLACED_TS_OFFSET));
        assertEquals(Side.BUY.code, f.getByte(p + Messages.PLACED_SIDE_OFFSET));
        assertEquals(BigInteger.valueOf(200), Messages.getUint256(f, p + Messages.PLACED_QUOTE_OFFSET));
        assertEquals("alice", Messages.getStr8(f, p + Messages.PLACED_OWNER_OFFSET));
    }

    @Test
    void testMatchedAndProcessedFrames() {
        listener.onOrderMatched(new OrderMatched(1L, 2L, ALICE, BOB,
                BigInteger.valueOf(100), BigInteger.valueOf(200), 9L));
        listener.onOrdersProcessed(new OrdersProcessed(3, 1, 9L));

        assertEquals(2, frames.size());
        UnsafeBuffer matched = frames.get(0);
        int p = Messages.FRAME_HEADER_SIZE;
        assertEquals(MsgType.ORDER_MATCHED, Messages.readFrameType(matched, 0));
        assertEquals(BigInteger.valueOf(100), Messages.getUint256(matched, p + Messages.MATCHED_BUYER_CREDIT_OFFSET));
        int buyerAt = p + Messages.MATCHED_BUYER_OFFSET;
        assertEquals("bob", Messages.getStr8(matched, buyerAt + Messages.str8Size(matched, buyerAt)));

        UnsafeBuffer processed = frames.get(1);
        assertEquals(MsgType.ORDERS_PROCESSED, Messages.readFrameType(processed, 0));
        assertEquals(3, Messages.getInt(processed, p + Messages.PROCESSED_PAIRS_OFFSET));
        assertEquals(1, Messages.getInt(processed, p + Messages.PROCESSED_MATCHED_OFFSET));
    }

    @Test
    void testCancelledFrameCarriesReason() {
        listener.onOrderCancelled(new OrderCancelled(4L, BOB, "expired", 1L));

        UnsafeBuffer f = frames.get(0);
        int ownerAt = Messages.FRAME_HEADER_SIZE + Messages.CANCELLED_OWNER_OFFSET;
        assertEquals("bob", Messages.getStr8(f, ownerAt));
        assertEquals("expired", Messages.getStr16(f, ownerAt + Messages.str8Size(f, ownerAt)));
    }
}
