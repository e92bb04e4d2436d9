package com.example.restaurant;

import java.math.BigDecimal;

/**
 * Renders pence amounts the way the console prints them.
 */
public final class Prices {

    private Prices() {
    }

    /**
     * Formats an amount in pence as a decimal with two fraction digits.
     * @param pence The amount, e.g. 1998.
     * @return The decimal string, e.g. "19.98".
     */
    public static String format(long pence) {
        return BigDecimal.valueOf(pence, 2).toPlainString();
    }
}
