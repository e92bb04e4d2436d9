package com.example.restaurant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Notification channel for an order. Observers are told about the order in
 * the order they were attached.
 */
public class Order {
    private static final Logger log = LoggerFactory.getLogger(Order.class);

    private final List<OrderObserver> observers = new ArrayList<>();

    public void attach(OrderObserver observer) {
        observers.add(Objects.requireNonNull(observer, "observer"));
    }

    public void notifyObservers() {
        log.info("Notifying {} observer(s) of order", observers.size());
        for (OrderObserver observer : observers) {
            observer.update(this);
        }
    }

    public List<OrderObserver> getObservers() {
        return Collections.unmodifiableList(observers);
    }
}
