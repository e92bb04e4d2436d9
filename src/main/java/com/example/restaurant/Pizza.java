package com.example.restaurant;

import java.util.List;

public final class Pizza implements MenuItem {
    public static final String NAME = "Pizza";
    public static final int PRICE_IN_PENCE = 1099;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getPriceInPence() {
        return PRICE_IN_PENCE;
    }

    @Override
    public List<String> getDisplayLines() {
        return List.of(NAME + " - $" + Prices.format(PRICE_IN_PENCE));
    }

    @Override
    public String toString() {
        return NAME;
    }
}
