package com.spotladder.infrastructure.paper;

import com.spotladder.domain.order.OrderStatus;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe simulated order book: order id to current status.
 */
public class PaperBrokerState {

    private final ConcurrentHashMap<String, OrderStatus> orders = new ConcurrentHashMap<>();

    public void put(String orderId, OrderStatus status) {
        orders.put(orderId, status);
    }

    public Optional<OrderStatus> status(String orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    public boolean contains(String orderId) {
        return orders.containsKey(orderId);
    }
}
