package com.example.reliablemq.publisher;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.example.reliablemq.connection.RabbitConnectionManager;
import com.example.reliablemq.exception.DeclareException;
import com.example.reliablemq.exception.PublishException;
import com.example.reliablemq.exception.SerializationException;
import com.example.reliablemq.logging.MessagingLogger;
import com.example.reliablemq.model.ExchangeOptions;
import com.example.reliablemq.model.PublishOptions;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;

/**
 * MessagePublisher 单元测试
 */
@ExtendWith(MockitoExtension.class)
class MessagePublisherTest {

    @Mock
    private RabbitConnectionManager connectionManager;

    @Mock
    private Channel channel;

    @Mock
    private MessagingLogger logger;

    @Captor
    private ArgumentCaptor<AMQP.BasicProperties> propsCaptor;

    @Captor
    private ArgumentCaptor<byte[]> bodyCaptor;

    private MessagePublisher messagePublisher;

    @BeforeEach
    void setUp() {
        lenient().when(connectionManager.getLogger()).thenReturn(logger);
        lenient().when(connectionManager.getChannel(any())).thenReturn(channel);
        messagePublisher = new MessagePublisher(connectionManager, new ObjectMapper());
    }

    @Test
    void testPublishToQueue() throws Exception {
        // When
        messagePublisher.publishToQueue("orders", Map.of("orderId", 42), null);

        // Then
        verify(channel).basicPublish(eq(""), eq("orders"), eq(false), propsCaptor.capture(), bodyCaptor.capture());
        AMQP.BasicProperties props = propsCaptor.getValue();
        assertEquals("application/json", props.getContentType());
        assertEquals(2, props.getDeliveryMode());
        assertEquals(0, props.getPriority());
        assertNull(props.getExpiration());
        assertEquals("{\"orderId\":42}", new String(bodyCaptor.getValue(), StandardCharsets.UTF_8));
        verify(channel, never()).queueDeclare(anyString(), anyBoolean(), anyBoolean(), anyBoolean(), any());
        verify(connectionManager, never()).ensureQueueExists(anyString());
    }

    @Test
    void testPublishToQueueWithOptions() throws Exception {
        // Given
        PublishOptions options = PublishOptions.builder()
                .persistent(false)
                .priority(5)
                .expiration("60000")
                .headers(Map.of("tenant", "acme"))
                .mandatory(true)
                .channelId("publisher")
                .build();

        // When
        messagePublisher.publishToQueue("orders", Map.of("orderId", 42), options);

        // Then
        verify(connectionManager).getChannel("publisher");
        verify(channel).basicPublish(eq(""), eq("orders"), eq(true), propsCaptor.capture(), any(byte[].class));
        AMQP.BasicProperties props = propsCaptor.getValue();
        assertEquals(1, props.getDeliveryMode());
        assertEquals(5, props.getPriority());
        assertEquals("60000", props.getExpiration());
        assertEquals("acme", props.getHeaders().get("tenant"));
    }

    @Test
    void testPublishDeclaresQueueBeforePublishing() throws Exception {
        // Given
        PublishOptions options = PublishOptions.builder().enableQueueDeclare(true).build();

        // When
        messagePublisher.publishToQueue("orders", Map.of("orderId", 42), options);

        // Then
        InOrder inOrder = inOrder(channel);
        inOrder.verify(channel).queueDeclare("orders", true, false, false, null);
        inOrder.verify(channel).basicPublish(eq(""), eq("orders"), eq(false), any(AMQP.BasicProperties.class),
                any(byte[].class));
    }

    @Test
    void testPublishVerifiesQueueExists() {
        PublishOptions options = PublishOptions.builder().verifyQueueExists(true).build();

        messagePublisher.publishToQueue("orders", Map.of("orderId", 42), options);

        verify(connectionManager).ensureQueueExists("orders");
    }

    @Test
    void testPriorityOutOfRange() {
        PublishOptions options = PublishOptions.builder().priority(10).build();

        assertThrows(IllegalArgumentException.class,
                () -> messagePublisher.publishToQueue("orders", "payload", options));
        verify(connectionManager, never()).getChannel(any());
    }

    @Test
    void testSerializationFailureSendsNothing() {
        assertThrows(SerializationException.class,
                () -> messagePublisher.publishToQueue("orders", new Object(), null));
        verifyNoInteractions(channel);
    }

    @Test
    void testPublishFailureWrapped() throws Exception {
        // Given
        doThrow(new IOException("channel closed")).when(channel)
                .basicPublish(anyString(), anyString(), anyBoolean(), any(AMQP.BasicProperties.class), any(byte[].class));

        // When / Then
        PublishException thrown = assertThrows(PublishException.class,
                () -> messagePublisher.publishToQueue("orders", "payload", null));
        assertTrue(thrown.getMessage().contains("orders"));
    }

    @Test
    void testPublishToQueueRaw() throws Exception {
        // Given
        byte[] body = new byte[] {0x01, 0x02};

        // When
        messagePublisher.publishToQueueRaw("blobs", body, null);

        // Then
        verify(channel).basicPublish(eq(""), eq("blobs"), eq(false), propsCaptor.capture(), eq(body));
        assertEquals("application/octet-stream", propsCaptor.getValue().getContentType());
    }

    @Test
    void testPublishToExchangeDeclaresExchange() throws Exception {
        // When
        messagePublisher.publishToExchange("events", "order.created", Map.of("orderId", 42), null, null);

        // Then
        InOrder inOrder = inOrder(channel);
        inOrder.verify(channel).exchangeDeclare(eq("events"), eq("topic"), eq(true), eq(false), eq(false), isNull());
        inOrder.verify(channel).basicPublish(eq("events"), eq("order.created"), eq(false),
                any(AMQP.BasicProperties.class), any(byte[].class));
    }

    @Test
    void testPublishToExchangeDeclareFailure() throws Exception {
        // Given
        ExchangeOptions options = ExchangeOptions.builder().type("fanout").build();
        when(channel.exchangeDeclare(eq("events"), eq("fanout"), anyBoolean(), anyBoolean(), anyBoolean(), any()))
                .thenThrow(new IOException("PRECONDITION_FAILED"));

        // When / Then
        assertThrows(DeclareException.class,
                () -> messagePublisher.publishToExchange("events", "", "payload", options, null));
        verify(channel, never()).basicPublish(anyString(), anyString(), anyBoolean(),
                any(AMQP.BasicProperties.class), any(byte[].class));
    }
}
