package com.example.restaurant;

/**
 * How an order total gets settled.
 */
public interface PaymentStrategy {

    /**
     * Settles the given amount and prints a confirmation line.
     * @param amountInPence The total to settle. Not validated.
     */
    void pay(long amountInPence);
}
