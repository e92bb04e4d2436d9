package com.example.restaurant;

import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Context tests. The console runner is switched off so nothing reads stdin.
 */
@SpringBootTest(properties = {
        "restaurant.console.enabled=false",
        "restaurant.notify-kitchen-on-payment=true"
})
class RestaurantApplicationTests {

    @Autowired ApplicationContext context;
    @Autowired OrderingConsole orderingConsole;
    @Autowired MenuItemFactory menuItemFactory;
    @Autowired RestaurantProperties properties;

    @Test
    void contextLoads_withConsoleComponents() {
        assertNotNull(orderingConsole);
        assertNotNull(menuItemFactory);
    }

    @Test
    void runner_notRegisteredWhenConsoleDisabled() {
        assertTrue(context.getBeansOfType(CommandLineRunner.class).isEmpty());
        assertFalse(properties.getConsole().isEnabled());
    }

    @Test
    void properties_boundFromEnvironment() {
        assertTrue(properties.isNotifyKitchenOnPayment());
    }

    @Test
    void applicationLogging_enabledAtInfo() {
        assertTrue(LoggerFactory.getLogger(OrderingConsole.class).isInfoEnabled());
        assertFalse(LoggerFactory.getLogger(OrderingConsole.class).isDebugEnabled());
    }
}
