package com.orderbook.protocol;

public enum Side {
    BUY((byte) 1), SELL((byte) 2);

    public final byte code;
    Side(byte code) { this.code = code; }

    public static Side fromCode(byte code) {
        switch (code) {
            case 1: return BUY;
            case 2: return SELL;
            default: throw new IllegalArgumentException("Unknown Side: " + code);
        }
    }

    public boolean isBuy() { return this == BUY; }
}
