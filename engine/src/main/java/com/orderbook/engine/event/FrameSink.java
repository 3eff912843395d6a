package com.orderbook.engine.event;

import org.agrona.DirectBuffer;

/**
 * Receives encoded notification frames. Implemented by the transport that
 * forwards them. The buffer is only valid for the duration of the call.
 */
@FunctionalInterface
public interface FrameSink {
    void onFrame(DirectBuffer buffer, int offset, int length);
}
