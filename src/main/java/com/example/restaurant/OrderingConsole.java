package com.example.restaurant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.Collectors;

/**
 * The interactive ordering loop. Each call to {@link #run} is one customer
 * session: it shows the main menu, reads one line per prompt and dispatches on
 * the number typed, until the customer exits or the input ends.
 */
@Component
public class OrderingConsole {
    private static final Logger log = LoggerFactory.getLogger(OrderingConsole.class);

    static final int DISPLAY_MENU = 1;
    static final int ADD_ITEM = 2;
    static final int MAKE_PAYMENT = 3;
    static final int EXIT = 4;

    private final MenuItemFactory menuItemFactory;
    private final RestaurantProperties properties;

    @Autowired
    public OrderingConsole(MenuItemFactory menuItemFactory, RestaurantProperties properties) {
        this.menuItemFactory = menuItemFactory;
        this.properties = properties;
    }

    /**
     * Runs a session until option 4 is chosen or {@code in} is exhausted.
     * @param in Customer input, one answer per line.
     * @param out Where menus, confirmations and payments are printed.
     */
    public void run(BufferedReader in, PrintStream out) {
        OrderSession session = new OrderSession(new OrderBuilder(), new Order());
        session.getOrder().attach(new Chef(out));

        out.println("Welcome to the Restaurant!");

        while (true) {
            printMainMenu(out);

            String line = readLine(in);
            if (line == null) {
                log.info("Input closed, ending session");
                return;
            }

            OptionalInt choice = parseInt(line);
            if (choice.isEmpty()) {
                rejectInput(out, line);
                continue;
            }

            switch (choice.getAsInt()) {
                case DISPLAY_MENU:
                    displayMenu(in, out);
                    break;
                case ADD_ITEM:
                    addItem(in, out, session);
                    break;
                case MAKE_PAYMENT:
                    makePayment(in, out, session);
                    break;
                case EXIT:
                    out.println("Exiting program. Goodbye!");
                    return;
                default:
                    out.println("Invalid choice. Please enter a valid option.");
                    break;
            }
        }
    }

    private void printMainMenu(PrintStream out) {
        out.println();
        out.println("Choose an option:");
        out.println(DISPLAY_MENU + ". Display Menu");
        out.println(ADD_ITEM + ". Add Item to Order");
        out.println(MAKE_PAYMENT + ". Make Payment");
        out.println(EXIT + ". Exit");
    }

    /**
     * Shows a fresh pizza and pasta, the pizza optionally topped with cheese.
     */
    void displayMenu(BufferedReader in, PrintStream out) {
        out.println("Menu Items:");
        MenuItem pizza = menuItemFactory.createMenuItem(MenuItemType.PIZZA);
        MenuItem pasta = menuItemFactory.createMenuItem(MenuItemType.PASTA);

        out.println("Do you want to add extra cheese to the pizza? (Y/N):");
        String answer = readLine(in);
        if (answer != null && "Y".equalsIgnoreCase(answer.trim())) {
            pizza = menuItemFactory.addCheese(pizza);
        }

        pizza.getDisplayLines().forEach(out::println);
        pasta.getDisplayLines().forEach(out::println);
    }

    void addItem(BufferedReader in, PrintStream out, OrderSession session) {
        out.println("Enter item number to add (" + itemNumberHint() + "):");
        OptionalInt itemNumber = promptForInt(in, out);
        if (itemNumber.isEmpty()) {
            return;
        }

        Optional<MenuItemType> type = MenuItemType.fromMenuNumber(itemNumber.getAsInt());
        if (type.isEmpty()) {
            out.println("Invalid item number.");
            return;
        }

        MenuItem item = menuItemFactory.createMenuItem(type.get());
        session.getOrderBuilder().addItem(item);
        out.println(item.getName() + " added to order.");
    }

    // "1 for Pizza, 2 for Pasta"
    private static String itemNumberHint() {
        return Arrays.stream(MenuItemType.values())
                .map(type -> type.getMenuNumber() + " for " + type.getDisplayName())
                .collect(Collectors.joining(", "));
    }

    void makePayment(BufferedReader in, PrintStream out, OrderSession session) {
        OrderBuilder orderBuilder = session.getOrderBuilder();
        if (orderBuilder.isEmpty()) {
            out.println("Please add items to the order first.");
            return;
        }

        out.println("Select payment method:");
        for (PaymentMethod method : PaymentMethod.values()) {
            out.println(method.getCode() + ". " + method.getLabel());
        }

        OptionalInt code = promptForInt(in, out);
        if (code.isEmpty()) {
            return;
        }

        PaymentMethod method = PaymentMethod.fromCode(code.getAsInt()).orElseGet(() -> {
            out.println("Invalid choice. Using default payment method (Cash).");
            return PaymentMethod.CASH;
        });
        PaymentStrategy paymentStrategy = method.createStrategy(out);

        long totalAmount = orderBuilder.calculateTotal();
        out.println("Total Amount: $" + Prices.format(totalAmount));
        paymentStrategy.pay(totalAmount);

        if (properties.isNotifyKitchenOnPayment()) {
            session.getOrder().notifyObservers();
        }
    }

    /**
     * Reads one line and parses it as an integer. Prints the invalid-input
     * message when the line is not a number.
     * @return The number, or empty when the line was invalid or input has ended.
     */
    private OptionalInt promptForInt(BufferedReader in, PrintStream out) {
        String line = readLine(in);
        if (line == null) {
            return OptionalInt.empty();
        }
        OptionalInt value = parseInt(line);
        if (value.isEmpty()) {
            rejectInput(out, line);
        }
        return value;
    }

    private void rejectInput(PrintStream out, String line) {
        log.debug("Rejected non-numeric input '{}'", line);
        out.println("Invalid input. Please enter a number.");
    }

    static OptionalInt parseInt(String line) {
        try {
            return OptionalInt.of(Integer.parseInt(line.trim()));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    private static String readLine(BufferedReader in) {
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read console input", e);
        }
    }
}
