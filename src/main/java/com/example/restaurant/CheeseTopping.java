package com.example.restaurant;

/**
 * Extra cheese: +1.50 on top of whatever it wraps.
 */
public class CheeseTopping extends ToppingDecorator {
    public static final int SURCHARGE_IN_PENCE = 150;

    public CheeseTopping(MenuItem menuItem) {
        super(menuItem);
    }

    @Override
    protected int getSurchargeInPence() {
        return SURCHARGE_IN_PENCE;
    }

    @Override
    protected String getToppingLine() {
        return " + Cheese";
    }

    @Override
    public String toString() {
        return getMenuItem() + " + Cheese";
    }
}
