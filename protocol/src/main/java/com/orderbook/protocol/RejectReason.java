package com.orderbook.protocol;

/**
 * Failure kinds surfaced by the book's boundary operations (1 byte on the wire).
 */
public enum RejectReason {
    UNKNOWN            ((byte) 0),
    INVALID_AMOUNT     ((byte) 1),
    ORDER_NOT_FOUND    ((byte) 2),
    UNAUTHORIZED       ((byte) 3),
    INVALID_BATCH_SIZE ((byte) 4);

    public final byte code;
    RejectReason(byte code) { this.code = code; }

    private static final RejectReason[] BY_CODE = new RejectReason[256];
    static {
        for (RejectReason r : values()) BY_CODE[Byte.toUnsignedInt(r.code)] = r;
    }

    public static RejectReason fromCode(byte code) {
        RejectReason r = BY_CODE[Byte.toUnsignedInt(code)];
        return r != null ? r : UNKNOWN;
    }
}
