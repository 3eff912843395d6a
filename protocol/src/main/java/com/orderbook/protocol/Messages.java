package com.orderbook.protocol;

import org.agrona.DirectBuffer;
import org.agrona.MutableDirectBuffer;

import java.math.BigInteger;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Binary codec for book notifications.
 *
 * Frame layout:
 *   [2 bytes LE: length of type + payload][1 byte: MsgType][N bytes: payload]
 *
 * Integers are little-endian. Amounts are unsigned 256-bit words, 32 bytes
 * big-endian. Strings are length-prefixed UTF-8: str8 (1 byte length) for trader
 * identities, str16 (2 byte LE length) for free text.
 *
 * OrderPlaced payload:
 *   orderId(8) timestamp(8) side(1) base(32) quote(32) owner(str8)
 * OrderCancelled payload:
 *   orderId(8) timestamp(8) owner(str8) reason(str16)
 * OrderMatched payload:
 *   buyId(8) sellId(8) timestamp(8) buyerCredit(32) sellerCredit(32) buyer(str8) seller(str8)
 * OrdersProcessed payload (16 bytes):
 *   pairsSubmitted(4) matchCount(4) timestamp(8)
 */
public final class Messages {

    // ---- Frame constants ----
    public static final int FRAME_LENGTH_OFFSET = 0;
    public static final int FRAME_TYPE_OFFSET   = 2;
    public static final int FRAME_HEADER_SIZE   = 3;

    public static final int UINT256_SIZE        = 32;
    public static final int MAX_IDENTITY_BYTES  = 255;
    public static final int MAX_REASON_BYTES    = 1024;

    public static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    // ---- OrderPlaced payload offsets (relative to payload start) ----
    public static final int PLACED_ORDER_ID_OFFSET  = 0;
    public static final int PLACED_TS_OFFSET        = 8;
    public static final int PLACED_SIDE_OFFSET      = 16;
    public static final int PLACED_BASE_OFFSET      = 17;
    public static final int PLACED_QUOTE_OFFSET     = 49;
    public static final int PLACED_OWNER_OFFSET     = 81;

    // ---- OrderCancelled payload ----
    public static final int CANCELLED_ORDER_ID_OFFSET = 0;
    public static final int CANCELLED_TS_OFFSET       = 8;
    public static final int CANCELLED_OWNER_OFFSET    = 16;

    // ---- OrderMatched payload ----
    public static final int MATCHED_BUY_ID_OFFSET        = 0;
    public static final int MATCHED_SELL_ID_OFFSET       = 8;
    public static final int MATCHED_TS_OFFSET            = 16;
    public static final int MATCHED_BUYER_CREDIT_OFFSET  = 24;
    public static final int MATCHED_SELLER_CREDIT_OFFSET = 56;
    public static final int MATCHED_BUYER_OFFSET         = 88;

    // ---- OrdersProcessed payload ----
    public static final int PROCESSED_PAIRS_OFFSET   = 0;
    public static final int PROCESSED_MATCHED_OFFSET = 4;
    public static final int PROCESSED_TS_OFFSET      = 8;
    public static final int PROCESSED_PAYLOAD_SIZE   = 16;

    private static final ByteOrder LE = ByteOrder.LITTLE_ENDIAN;

    // ---- Frame helpers ----

    public static void writeFrameHeader(MutableDirectBuffer buf, int offset, MsgType type, int payloadSize) {
        // Length = bytes following the 2-byte length field = 1 (type) + payloadSize
        buf.putShort(offset + FRAME_LENGTH_OFFSET, (short) (1 + payloadSize), LE);
        buf.putByte(offset + FRAME_TYPE_OFFSET, type.code);
    }

    public static int readFrameLength(DirectBuffer buf, int offset) {
        return buf.getShort(offset + FRAME_LENGTH_OFFSET, LE) & 0xFFFF;
    }

    public static MsgType readFrameType(DirectBuffer buf, int offset) {
        return MsgType.fromCode(buf.getByte(offset + FRAME_TYPE_OFFSET));
    }

    // ---- OrderPlaced encode ----

    public static int encodeOrderPlaced(MutableDirectBuffer buf, int offset,
                                        long orderId, long timestamp, Side side,
                                        BigInteger baseAmount, BigInteger quoteAmount, String owner) {
        byte[] ownerBytes = identityBytes(owner);
        int p = offset + FRAME_HEADER_SIZE;
        buf.putLong(p + PLACED_ORDER_ID_OFFSET, orderId, LE);
        buf.putLong(p + PLACED_TS_OFFSET, timestamp, LE);
        buf.putByte(p + PLACED_SIDE_OFFSET, side.code);
        putUint256(buf, p + PLACED_BASE_OFFSET, baseAmount);
        putUint256(buf, p + PLACED_QUOTE_OFFSET, quoteAmount);
        int payloadSize = PLACED_OWNER_OFFSET + putStr8(buf, p + PLACED_OWNER_OFFSET, ownerBytes);
        writeFrameHeader(buf, offset, MsgType.ORDER_PLACED, payloadSize);
        return FRAME_HEADER_SIZE + payloadSize;
    }

    // ---- OrderCancelled encode ----

    public static int encodeOrderCancelled(MutableDirectBuffer buf, int offset,
                                           long orderId, long timestamp, String owner, String reason) {
        byte[] ownerBytes = identityBytes(owner);
        byte[] reasonBytes = reason.getBytes(StandardCharsets.UTF_8);
        if (reasonBytes.length > MAX_REASON_BYTES) {
            throw new IllegalArgumentException("Reason exceeds " + MAX_REASON_BYTES + " bytes");
        }
        int p = offset + FRAME_HEADER_SIZE;
        buf.putLong(p + CANCELLED_ORDER_ID_OFFSET, orderId, LE);
        buf.putLong(p + CANCELLED_TS_OFFSET, timestamp, LE);
        int cursor = CANCELLED_OWNER_OFFSET;
        cursor += putStr8(buf, p + cursor, ownerBytes);
        cursor += putStr16(buf, p + cursor, reasonBytes);
        writeFrameHeader(buf, offset, MsgType.ORDER_CANCELLED, cursor);
        return FRAME_HEADER_SIZE + cursor;
    }

    // ---- OrderMatched encode ----

    public static int encodeOrderMatched(MutableDirectBuffer buf, int offset,
                                         long buyId, long sellId, long timestamp,
                                         BigInteger buyerCredit, BigInteger sellerCredit,
                                         String buyer, String seller) {
        byte[] buyerBytes = identityBytes(buyer);
        byte[] sellerBytes = identityBytes(seller);
        int p = offset + FRAME_HEADER_SIZE;
        buf.putLong(p + MATCHED_BUY_ID_OFFSET, buyId, LE);
        buf.putLong(p + MATCHED_SELL_ID_OFFSET, sellId, LE);
        buf.putLong(p + MATCHED_TS_OFFSET, timestamp, LE);
        putUint256(buf, p + MATCHED_BUYER_CREDIT_OFFSET, buyerCredit);
        putUint256(buf, p + MATCHED_SELLER_CREDIT_OFFSET, sellerCredit);
        int cursor = MATCHED_BUYER_OFFSET;
        cursor += putStr8(buf, p + cursor, buyerBytes);
        cursor += putStr8(buf, p + cursor, sellerBytes);
        writeFrameHeader(buf, offset, MsgType.ORDER_MATCHED, cursor);
        return FRAME_HEADER_SIZE + cursor;
    }

    // ---- OrdersProcessed encode ----

    public static int encodeOrdersProcessed(MutableDirectBuffer buf, int offset,
                                            int pairsSubmitted, int matchCount, long timestamp) {
        writeFrameHeader(buf, offset, MsgType.ORDERS_PROCESSED, PROCESSED_PAYLOAD_SIZE);
        int p = offset + FRAME_HEADER_SIZE;
        buf.putInt(p + PROCESSED_PAIRS_OFFSET, pairsSubmitted, LE);
        buf.putInt(p + PROCESSED_MATCHED_OFFSET, matchCount, LE);
        buf.putLong(p + PROCESSED_TS_OFFSET, timestamp, LE);
        return FRAME_HEADER_SIZE + PROCESSED_PAYLOAD_SIZE;
    }

    // ---- Field helpers ----

    public static void putUint256(MutableDirectBuffer buf, int offset, BigInteger value) {
        if (value.signum() < 0 || value.bitLength() > 256) {
            throw new IllegalArgumentException("Not a uint256: " + value);
        }
        byte[] raw = value.toByteArray();
        // toByteArray may carry a leading sign byte
        int srcStart = Math.max(0, raw.length - UINT256_SIZE);
        int len = raw.length - srcStart;
        buf.setMemory(offset, UINT256_SIZE - len, (byte) 0);
        buf.putBytes(offset + UINT256_SIZE - len, raw, srcStart, len);
    }

    public static BigInteger getUint256(DirectBuffer buf, int offset) {
        byte[] raw = new byte[UINT256_SIZE];
        buf.getBytes(offset, raw);
        return new BigInteger(1, raw);
    }

    public static long getLong(DirectBuffer buf, int offset) {
        return buf.getLong(offset, LE);
    }

    public static int getInt(DirectBuffer buf, int offset) {
        return buf.getInt(offset, LE);
    }

    /** Total encoded size (prefix included) of the str8 at {@code offset}. */
    public static int str8Size(DirectBuffer buf, int offset) {
        return 1 + Byte.toUnsignedInt(buf.getByte(offset));
    }

    public static String getStr8(DirectBuffer buf, int offset) {
        int len = Byte.toUnsignedInt(buf.getByte(offset));
        byte[] bytes = new byte[len];
        buf.getBytes(offset + 1, bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    public static String getStr16(DirectBuffer buf, int offset) {
        int len = buf.getShort(offset, LE) & 0xFFFF;
        byte[] bytes = new byte[len];
        buf.getBytes(offset + 2, bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static byte[] identityBytes(String identity) {
        byte[] bytes = identity.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > MAX_IDENTITY_BYTES) {
            throw new IllegalArgumentException("Identity exceeds " + MAX_IDENTITY_BYTES + " bytes");
        }
        return bytes;
    }

    private static int putStr8(MutableDirectBuffer buf, int offset, byte[] bytes) {
        buf.putByte(offset, (byte) bytes.length);
        buf.putBytes(offset + 1, bytes);
        return 1 + bytes.length;
    }

    private static int putStr16(MutableDirectBuffer buf, int offset, byte[] bytes) {
        buf.putShort(offset, (short) bytes.length, LE);
        buf.putBytes(offset + 2, bytes);
        return 2 + bytes.length;
    }

    private Messages() {}
}
