package com.example.reliablemq.retry;

import java.io.IOException;

import com.example.reliablemq.model.MessageDelivery;
import com.rabbitmq.client.Channel;

/**
 * 重试策略
 *
 * 策略对象只保存不可变配置，重试次数随消息头部传递，可在多个消费线程间共享。
 * 生命周期：消费者启动时创建一次，队列声明之后、开始消费之前调用一次 {@link #setup}，
 * 之后每条失败消息依次调用 {@link #shouldRetry}、{@link #handleFailure}。
 */
public sealed interface RetryStrategy
        permits ImmediateRetryStrategy, FixedDelayRetryStrategy, ExponentialBackoffRetryStrategy {

    int getMaxAttempts();

    /**
     * 头部中的重试次数小于 maxAttempts 时返回 true
     */
    default boolean shouldRetry(MessageDelivery delivery) {
        return delivery.getRetryMetadata().getAttemptCount() < getMaxAttempts();
    }

    /**
     * 第 attemptCount 次重试前的等待时间（毫秒）
     */
    long getDelay(int attemptCount);

    /**
     * 准备重试所需的 Broker 拓扑，重复调用不会产生重复拓扑
     */
    void setup(Channel channel, String originalQueue) throws IOException;

    /**
     * 按策略重新路由失败消息，调用前必须已经通过 {@link #shouldRetry} 检查
     */
    RetryAction handleFailure(Channel channel, MessageDelivery delivery) throws IOException;
}
