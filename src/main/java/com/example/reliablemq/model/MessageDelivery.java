package com.example.reliablemq.model;

import java.util.LinkedHashMap;
import java.util.Map;

import com.example.reliablemq.retry.RetryMetadata;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Envelope;

import lombok.Getter;
import lombok.ToString;

/**
 * 一条正在处理中的消息
 *
 * 每次投递都持有自己的一份头部副本，重试元数据只修改这份副本，
 * 并发处理的多条消息之间不共享可变状态。
 */
@Getter
@ToString(exclude = "body")
public class MessageDelivery {

    /** 消费的队列名（重试拓扑按此命名） */
    private final String queue;

    private final String consumerTag;

    private final long deliveryTag;

    private final boolean redelivered;

    private final String exchange;

    private final String routingKey;

    private final AMQP.BasicProperties properties;

    private final byte[] body;

    private final Map<String, Object> headers;

    public MessageDelivery(String queue, String consumerTag, Envelope envelope,
                           AMQP.BasicProperties properties, byte[] body) {
        this.queue = queue;
        this.consumerTag = consumerTag;
        this.deliveryTag = envelope.getDeliveryTag();
        this.redelivered = envelope.isRedeliver();
        this.exchange = envelope.getExchange();
        this.routingKey = envelope.getRoutingKey();
        this.properties = properties != null ? properties : new AMQP.BasicProperties();
        this.body = body != null ? body : new byte[0];
        this.headers = this.properties.getHeaders() != null
                ? new LinkedHashMap<>(this.properties.getHeaders())
                : new LinkedHashMap<>();
    }

    public String getContentType() {
        return properties.getContentType();
    }

    public Integer getPriority() {
        return properties.getPriority();
    }

    public Integer getDeliveryMode() {
        return properties.getDeliveryMode();
    }

    public Map<String, Object> getHeaders() {
        return headers;
    }

    public RetryMetadata getRetryMetadata() {
        return RetryMetadata.from(headers);
    }
}
