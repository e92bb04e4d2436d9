package com.example.restaurant;

import java.io.PrintStream;
import java.util.Objects;

/**
 * The kitchen side of an order. Announces every order it is told about.
 */
public class Chef implements OrderObserver {
    private final PrintStream out;

    public Chef(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void update(Order order) {
        out.println("Chef: New order received.");
    }
}
