package com.example.reliablemq.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

/**
 * MessageDelivery 单元测试
 */
class MessageDeliveryTest {

    @Test
    void testHeadersAreCopiedPerDelivery() {
        // Given
        Map<String, Object> original = new HashMap<>();
        original.put("x-retry-count", 1);

        // When
        MessageDelivery delivery = Deliveries.of("orders", 7L, original);
        delivery.getHeaders().put("x-retry-count", 2);

        // Then
        assertEquals(1, original.get("x-retry-count"));
        assertEquals(2, delivery.getRetryMetadata().getAttemptCount());
    }

    @Test
    void testMissingHeadersGiveEmptyMap() {
        MessageDelivery delivery = Deliveries.of("orders", 1L);

        assertTrue(delivery.getHeaders().isEmpty());
        assertEquals(0, delivery.getRetryMetadata().getAttemptCount());
        assertEquals(1L, delivery.getDeliveryTag());
        assertEquals("application/json", delivery.getContentType());
    }
}
