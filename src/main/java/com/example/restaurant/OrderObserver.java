package com.example.restaurant;

public interface OrderObserver {

    void update(Order order);
}
