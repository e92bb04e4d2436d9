package com.example.restaurant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Objects;

public class CashPayment implements PaymentStrategy {
    private static final Logger log = LoggerFactory.getLogger(CashPayment.class);

    private final PrintStream out;

    public CashPayment(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void pay(long amountInPence) {
        log.info("Settling {} pence in cash", amountInPence);
        out.println("Paid $" + Prices.format(amountInPence) + " by cash.");
    }
}
