package com.example.restaurant;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "restaurant")
public class RestaurantProperties {

    /**
     * Notify the order's observers (the chef) once a payment has gone through.
     */
    private boolean notifyKitchenOnPayment = false;

    private final Console console = new Console();

    public boolean isNotifyKitchenOnPayment() {
        return notifyKitchenOnPayment;
    }

    public void setNotifyKitchenOnPayment(boolean notifyKitchenOnPayment) {
        this.notifyKitchenOnPayment = notifyKitchenOnPayment;
    }

    public Console getConsole() {
        return console;
    }

    /**
     * {@code restaurant.console.*}. The runner bean is gated by
     * {@code @ConditionalOnProperty} on the same key, which reads the environment
     * directly; the field exists so the key is bound, defaulted and documented
     * alongside the other restaurant settings.
     */
    public static class Console {

        /**
         * Run the interactive console on startup.
         */
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
