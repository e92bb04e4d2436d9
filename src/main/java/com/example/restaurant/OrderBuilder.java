package com.example.restaurant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Accumulates the items picked during a session. Items are only ever appended.
 */
public class OrderBuilder {
    private static final Logger log = LoggerFactory.getLogger(OrderBuilder.class);

    private final List<MenuItem> items = new ArrayList<>();

    public OrderBuilder addItem(MenuItem item) {
        items.add(Objects.requireNonNull(item, "item"));
        log.debug("Added {} to order, {} item(s) now", item, items.size());
        return this;
    }

    /**
     * Sums the prices of all items currently in the order.
     * @return The total in pence; 0 for an empty order.
     */
    public long calculateTotal() {
        return items.stream()
                .mapToLong(MenuItem::getPriceInPence)
                .sum();
    }

    public int getItemCount() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public List<MenuItem> getItems() {
        return Collections.unmodifiableList(items);
    }
}
