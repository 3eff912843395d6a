package com.orderbook.protocol;

/**
 * Wire message type codes (1 byte).
 *
 * Book notifications (engine -> observers): 40-59
 */
public enum MsgType {
    ORDER_PLACED     ((byte) 40),
    ORDER_CANCELLED  ((byte) 41),
    ORDER_MATCHED    ((byte) 42),
    ORDERS_PROCESSED ((byte) 43);

    public final byte code;

    MsgType(byte code) { this.code = code; }

    private static final MsgType[] BY_CODE = new MsgType[256];
    static {
        for (MsgType t : values()) BY_CODE[Byte.toUnsignedInt(t.code)] = t;
    }

    public static MsgType fromCode(byte code) {
        MsgType t = BY_CODE[Byte.toUnsignedInt(code)];
        if (t == null) throw new IllegalArgumentException("Unknown MsgType: " + code);
        return t;
    }
}
