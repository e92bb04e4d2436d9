package com.example.restaurant;

import org.springframework.stereotype.Component;

import java.util.Objects;

@Component
public class MenuItemFactory {

    /**
     * Creates a fresh menu item of the given type.
     * @param type The kind of item to make.
     * @return A new item with that type's fixed name and price.
     */
    public MenuItem createMenuItem(MenuItemType type) {
        Objects.requireNonNull(type, "type");
        switch (type) {
            case PIZZA:
                return new Pizza();
            case PASTA:
                return new Pasta();
            default:
                throw new IllegalArgumentException("Unknown menu item type: " + type);
        }
    }

    /**
     * Wraps an item in extra cheese.
     * @param item The item to decorate; may itself be decorated.
     * @return The decorated item, 1.50 dearer with an extra " + Cheese" line.
     */
    public MenuItem addCheese(MenuItem item) {
        return new CheeseTopping(item);
    }
}
