package com.orderbook.engine.event;

import com.orderbook.engine.book.TraderId;

public record OrderCancelled(long orderId, TraderId owner, String reason, long timestamp) {}
