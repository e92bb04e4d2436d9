package com.example.restaurant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class OrderTests {

    @Mock private OrderObserver first;
    @Mock private OrderObserver second;

    private Order order;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        order = new Order();
    }

    @Test
    void notifyObservers_callsEachObserverInAttachmentOrder() {
        order.attach(first);
        order.attach(second);

        order.notifyObservers();

        InOrder inOrder = inOrder(first, second);
        inOrder.verify(first).update(order);
        inOrder.verify(second).update(order);
        verifyNoMoreInteractions(first, second);
    }

    @Test
    void attach_withoutNotify_neverCallsObserver() {
        order.attach(first);
        verifyNoInteractions(first);
    }

    @Test
    void notifyObservers_noObservers_doesNothing() {
        assertDoesNotThrow(() -> order.notifyObservers());
        assertTrue(order.getObservers().isEmpty());
    }

    @Test
    void attach_null_throws() {
        assertThrows(NullPointerException.class, () -> order.attach(null));
    }

    @Test
    void chef_announcesNewOrder() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        order.attach(new Chef(new PrintStream(buffer, true, StandardCharsets.UTF_8)));

        order.notifyObservers();

        assertEquals("Chef: New order received." + System.lineSeparator(), buffer.toString(StandardCharsets.UTF_8));
    }
}
