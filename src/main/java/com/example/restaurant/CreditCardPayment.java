package com.example.restaurant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Objects;

public class CreditCardPayment implements PaymentStrategy {
    private static final Logger log = LoggerFactory.getLogger(CreditCardPayment.class);

    private final PrintStream out;

    public CreditCardPayment(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void pay(long amountInPence) {
        log.info("Settling {} pence by credit card", amountInPence);
        out.println("Paid $" + Prices.format(amountInPence) + " by credit card.");
    }
}
