package com.example.restaurant;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.io.BufferedReader;
import java.io.InputStreamReader;

@SpringBootApplication
@EnableConfigurationProperties(RestaurantProperties.class)
public class RestaurantApplication {

    public static void main(String[] args) {
        SpringApplication.run(RestaurantApplication.class, args);
    }

    @Bean
    @ConditionalOnProperty(prefix = "restaurant.console", name = "enabled", havingValue = "true", matchIfMissing = true)
    public CommandLineRunner orderingConsoleRunner(OrderingConsole orderingConsole) {
        return args -> orderingConsole.run(new BufferedReader(new InputStreamReader(System.in)), System.out);
    }
}
