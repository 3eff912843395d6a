package com.orderbook.engine.book;

import com.orderbook.protocol.Messages;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Identity of an order submitter as supplied by the transport (e.g. the signer
 * of a request). Opaque to the book beyond equality.
 */
public record TraderId(String value) {

    public TraderId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Trader identity must not be blank");
        }
        if (value.getBytes(StandardCharsets.UTF_8).length > Messages.MAX_IDENTITY_BYTES) {
            throw new IllegalArgumentException("Trader identity exceeds " + Messages.MAX_IDENTITY_BYTES + " bytes");
        }
    }

    public static TraderId of(String value) {
        return new TraderId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
