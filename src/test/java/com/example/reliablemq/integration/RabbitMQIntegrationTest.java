package com.example.reliablemq.integration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.awaitility.Awaitility.await;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.RabbitMQContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import com.example.reliablemq.connection.RabbitConnectionManager;
import com.example.reliablemq.consumer.QueueConsumer;
import com.example.reliablemq.exception.QueueNotFoundException;
import com.example.reliablemq.model.ConsumeOptions;
import com.example.reliablemq.model.PublishOptions;
import com.example.reliablemq.publisher.MessagePublisher;
import com.example.reliablemq.retry.ExponentialBackoffRetryStrategy;
import com.example.reliablemq.retry.FixedDelayRetryStrategy;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.GetResponse;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * RabbitMQ 集成测试
 *
 * 使用 Testcontainers 启动真实 Broker，没有 Docker 时跳过。
 * 每个用例使用独立的队列名，避免用例之间互相干扰。
 */
@SpringBootTest(classes = RabbitMQIntegrationTest.TestApplication.class)
@Testcontainers(disabledWithoutDocker = true)
class RabbitMQIntegrationTest {

    @Container
    static RabbitMQContainer rabbit = new RabbitMQContainer(DockerImageName.parse("rabbitmq:3.13-management-alpine"));

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("reliablemq.rabbitmq.url", rabbit::getAmqpUrl);
        registry.add("reliablemq.rabbitmq.prefetch", () -> "5");
        registry.add("reliablemq.rabbitmq.handler-threads", () -> "4");
    }

    @SpringBootConfiguration
    @EnableAutoConfiguration
    static class TestApplication {
    }

    @Autowired
    private ApplicationContext applicationContext;

    @Autowired
    private RabbitConnectionManager connectionManager;

    @Autowired
    private MessagePublisher messagePublisher;

    @Autowired
    private QueueConsumer queueConsumer;

    @Test
    void testOnlyOwnConnectionIsCreated() {
        assertFalse(applicationContext.containsBean("rabbitConnectionFactory"));
        assertFalse(applicationContext.containsBean("rabbitTemplate"));
        assertTrue(connectionManager.isConnected());
    }

    private static String uniqueQueue(String prefix) {
        return prefix + "." + UUID.randomUUID().toString().substring(0, 8);
    }

    @Test
    void testPublishAndConsumeJson() {
        // Given
        String queue = uniqueQueue("orders");
        List<OrderEvent> received = new CopyOnWriteArrayList<>();
        queueConsumer.consumeJson(queue, OrderEvent.class, (event, delivery) -> received.add(event), null);

        // When
        messagePublisher.publishToQueue(queue, new OrderEvent(42L, "CREATED"), null);

        // Then
        await().atMost(Duration.ofSeconds(10)).until(() -> received.size() == 1);
        assertEquals(new OrderEvent(42L, "CREATED"), received.get(0));

        queueConsumer.cancelConsumer(queue);
        assertTrue(connectionManager.getConsumerTag(queue).isEmpty());
    }

    @Test
    void testFixedDelayRetriesThenDrops() throws Exception {
        // Given: 处理器总是失败，最多重试 2 次
        String queue = uniqueQueue("fixed");
        List<Integer> seenRetryCounts = new CopyOnWriteArrayList<>();
        ConsumeOptions options = ConsumeOptions.builder()
                .retryStrategy(new FixedDelayRetryStrategy(2, 500))
                .build();
        queueConsumer.consumeQueue(queue, (payload, delivery) -> {
            seenRetryCounts.add(delivery.getRetryMetadata().getAttemptCount());
            throw new IllegalStateException("downstream unavailable");
        }, options);

        // When
        messagePublisher.publishToQueue(queue, Map.of("orderId", 1), null);

        // Then
        await().atMost(Duration.ofSeconds(10)).until(() -> seenRetryCounts.size() == 3);
        assertEquals(List.of(0, 1, 2), seenRetryCounts);

        // 重试耗尽后 nack(requeue=false)，未开启 DLQ 时消息被丢弃
        Thread.sleep(1500);
        assertEquals(3, seenRetryCounts.size());
        Channel inspector = connectionManager.getChannel("inspector");
        assertEquals(0L, inspector.messageCount(queue + ".wait"));

        queueConsumer.cancelConsumer(queue);
    }

    @Test
    void testExponentialBackoffEndsInDeadLetterQueue() {
        // Given
        String queue = uniqueQueue("backoff");
        AtomicInteger attempts = new AtomicInteger();
        ConsumeOptions options = ConsumeOptions.builder()
                .retryStrategy(new ExponentialBackoffRetryStrategy(3, 100, 2.0))
                .enableDlq(true)
                .build();
        queueConsumer.consumeQueue(queue, (payload, delivery) -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("always fails");
        }, options);

        // When
        messagePublisher.publishToQueue(queue, Map.of("orderId", 2), null);

        // Then
        Channel inspector = connectionManager.getChannel("inspector");
        GetResponse deadLettered = await().atMost(Duration.ofSeconds(15))
                .until(() -> inspector.basicGet(queue + ".failed", true), response -> response != null);

        assertEquals(4, attempts.get());
        Map<String, Object> headers = deadLettered.getProps().getHeaders();
        assertEquals(3, ((Number) headers.get("x-retry-count")).intValue());
        assertEquals(queue, headers.get("x-original-queue").toString());
        assertTrue(headers.containsKey("x-first-failed-at"));

        queueConsumer.cancelConsumer(queue);
    }

    @Test
    void testPublishToMissingQueue() {
        // Given
        String missing = uniqueQueue("missing");
        AtomicInteger returned = new AtomicInteger();
        connectionManager.addReturnListener((replyCode, replyText, exchange, routingKey, properties, body) -> {
            if (missing.equals(routingKey)) {
                returned.set(replyCode);
            }
        });

        // When: 默认 mandatory=false
        messagePublisher.publishToQueue(missing, Map.of("orderId", 3), null);

        // Then: Broker 静默丢弃，不会退回
        await().during(Duration.ofMillis(500)).atMost(Duration.ofSeconds(2)).until(() -> returned.get() == 0);

        PublishOptions mandatory = PublishOptions.builder().mandatory(true).build();
        messagePublisher.publishToQueue(missing, Map.of("orderId", 3), mandatory);
        await().atMost(Duration.ofSeconds(10)).until(() -> returned.get() == 312);

        PublishOptions verify = PublishOptions.builder().verifyQueueExists(true).build();
        assertThrows(QueueNotFoundException.class,
                () -> messagePublisher.publishToQueue(missing, Map.of("orderId", 3), verify));

        // 被动检查失败不影响默认通道
        assertTrue(connectionManager.getChannel(null).isOpen());
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OrderEvent {
        private long orderId;
        private String status;
    }
}
