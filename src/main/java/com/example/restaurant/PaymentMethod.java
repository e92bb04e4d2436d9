package com.example.restaurant;

import java.io.PrintStream;
import java.util.Optional;

/**
 * Payment methods offered at checkout, keyed by the code typed at the prompt.
 */
public enum PaymentMethod {
    CASH(1, "Cash Payment") {
        @Override
        public PaymentStrategy createStrategy(PrintStream out) {
            return new CashPayment(out);
        }
    },
    CREDIT_CARD(2, "Credit Card Payment") {
        @Override
        public PaymentStrategy createStrategy(PrintStream out) {
            return new CreditCardPayment(out);
        }
    };

    private final int code;
    private final String label;

    PaymentMethod(int code, String label) {
        this.code = code;
        this.label = label;
    }

    public int getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    public abstract PaymentStrategy createStrategy(PrintStream out);

    /**
     * @param code The code typed at the payment prompt.
     * @return The matching method, or empty for an unknown code.
     */
    public static Optional<PaymentMethod> fromCode(int code) {
        for (PaymentMethod method : values()) {
            if (method.code == code) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }
}
