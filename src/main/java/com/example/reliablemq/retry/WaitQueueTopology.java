package com.example.reliablemq.retry;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import org.springframework.amqp.core.ExchangeTypes;

import com.example.reliablemq.constant.MessagingConstants.QueueArguments;
import com.example.reliablemq.constant.MessagingConstants.Topology;
import com.example.reliablemq.model.MessageDelivery;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;

/**
 * 延迟重试共用的拓扑操作
 *
 * 等待队列不被消费，消息 TTL 到期后经 {@code <queue>.dlx} 死信回原队列，
 * TTL 到期是消息从“等待”进入“重投”的唯一途径。
 */
final class WaitQueueTopology {

    private WaitQueueTopology() {
    }

    static void declareRetryExchange(Channel channel, String originalQueue) throws IOException {
        channel.exchangeDeclare(Topology.retryExchange(originalQueue), ExchangeTypes.DIRECT, true, false, false, null);
    }

    static void declareWaitQueue(Channel channel, String waitQueue, String originalQueue, long ttlMs) throws IOException {
        Map<String, Object> args = new HashMap<>();
        args.put(QueueArguments.DEAD_LETTER_EXCHANGE, Topology.retryExchange(originalQueue));
        args.put(QueueArguments.DEAD_LETTER_ROUTING_KEY, originalQueue);
        args.put(QueueArguments.MESSAGE_TTL, Math.toIntExact(ttlMs));
        channel.queueDeclare(waitQueue, true, false, false, args);
    }

    static void bindOriginalQueue(Channel channel, String originalQueue) throws IOException {
        channel.queueBind(originalQueue, Topology.retryExchange(originalQueue), originalQueue);
    }

    /**
     * 以相同的消息体、属性和（已更新的）头部发布到等待队列
     */
    static void publishToWaitQueue(Channel channel, String waitQueue, MessageDelivery delivery) throws IOException {
        AMQP.BasicProperties source = delivery.getProperties();
        AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
                .contentType(source.getContentType())
                .contentEncoding(source.getContentEncoding())
                .deliveryMode(source.getDeliveryMode())
                .priority(source.getPriority())
                .correlationId(source.getCorrelationId())
                .messageId(source.getMessageId())
                .timestamp(source.getTimestamp())
                .type(source.getType())
                .appId(source.getAppId())
                .headers(new HashMap<>(delivery.getHeaders()))
                .build();
        channel.basicPublish("", waitQueue, false, properties, delivery.getBody());
    }
}
