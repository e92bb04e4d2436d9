package com.example.restaurant;

/**
 * State of one run of the ordering console: the items picked so far and the
 * order's notification channel.
 */
public class OrderSession {
    private final OrderBuilder orderBuilder;
    private final Order order;

    public OrderSession(OrderBuilder orderBuilder, Order order) {
        this.orderBuilder = orderBuilder;
        this.order = order;
    }

    public OrderBuilder getOrderBuilder() {
        return orderBuilder;
    }

    public Order getOrder() {
        return order;
    }
}
