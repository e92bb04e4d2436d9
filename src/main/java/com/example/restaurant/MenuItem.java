package com.example.restaurant;

import java.util.List;

/**
 * A priceable, displayable entry on the menu. Implementations are immutable.
 */
public interface MenuItem {

    String getName();

    /**
     * @return The price of this item in pence, including any decorations.
     */
    int getPriceInPence();

    /**
     * Lines printed when the item is shown on the menu, e.g. "Pizza - $10.99".
     * Decorations append their own lines after the wrapped item's.
     */
    List<String> getDisplayLines();
}
