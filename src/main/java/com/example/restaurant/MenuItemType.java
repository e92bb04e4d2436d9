package com.example.restaurant;

import java.util.Optional;

/**
 * The closed set of items the kitchen can make, keyed by their number on the menu.
 */
public enum MenuItemType {
    PIZZA(1, Pizza.NAME),
    PASTA(2, Pasta.NAME);

    private final int menuNumber;
    private final String displayName;

    MenuItemType(int menuNumber, String displayName) {
        this.menuNumber = menuNumber;
        this.displayName = displayName;
    }

    public int getMenuNumber() {
        return menuNumber;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static Optional<MenuItemType> fromMenuNumber(int menuNumber) {
        for (MenuItemType type : values()) {
            if (type.menuNumber == menuNumber) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
