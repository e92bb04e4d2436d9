package com.example.restaurant;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base for toppings. A topping wraps another menu item, adds a fixed surcharge
 * to its price and one extra display line after the wrapped item's lines.
 */
public abstract class ToppingDecorator implements MenuItem {
    private final MenuItem menuItem;

    protected ToppingDecorator(MenuItem menuItem) {
        this.menuItem = Objects.requireNonNull(menuItem, "menuItem");
    }

    public MenuItem getMenuItem() {
        return menuItem;
    }

    /**
     * @return The surcharge for this topping, in pence.
     */
    protected abstract int getSurchargeInPence();

    /**
     * @return The line appended to the wrapped item's display.
     */
    protected abstract String getToppingLine();

    @Override
    public String getName() {
        return menuItem.getName();
    }

    @Override
    public int getPriceInPence() {
        return menuItem.getPriceInPence() + getSurchargeInPence();
    }

    @Override
    public List<String> getDisplayLines() {
        List<String> lines = new ArrayList<>(menuItem.getDisplayLines());
        lines.add(getToppingLine());
        return Collections.unmodifiableList(lines);
    }
}
