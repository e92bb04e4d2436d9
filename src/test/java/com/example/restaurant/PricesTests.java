package com.example.restaurant;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PricesTests {

    @Test
    void format_usesTwoFractionDigits() {
        assertEquals("10.99", Prices.format(1099));
        assertEquals("8.99", Prices.format(899));
        assertEquals("1.50", Prices.format(150));
        assertEquals("0.00", Prices.format(0));
        assertEquals("0.05", Prices.format(5));
    }

    @Test
    void format_largeAmounts_noGrouping() {
        assertEquals("12345.67", Prices.format(1234567));
    }

    @Test
    void format_amountsBeyondIntRange() {
        assertEquals("21980000.00", Prices.format(2_198_000_000L));
    }
}
