package com.example.reliablemq.retry;

import java.io.IOException;
import java.time.Clock;

import com.example.reliablemq.constant.MessagingConstants.Topology;
import com.example.reliablemq.model.MessageDelivery;
import com.google.common.base.Preconditions;
import com.rabbitmq.client.Channel;

import lombok.Getter;
import lombok.ToString;

/**
 * 固定延迟重试
 *
 * 拓扑：{@code <queue>.dlx}（direct）+ 一个 {@code <queue>.wait}（TTL=delayMs），
 * 原队列以队列名为路由键绑定到 {@code <queue>.dlx}。
 * 失败消息发布到等待队列，TTL 到期后经 DLX 回到原队列。
 */
@Getter
@ToString(exclude = "clock")
public final class FixedDelayRetryStrategy implements RetryStrategy {

    private final int maxAttempts;

    private final long delayMs;

    private final Clock clock;

    public FixedDelayRetryStrategy(int maxAttempts, long delayMs) {
        this(maxAttempts, delayMs, Clock.systemUTC());
    }

    public FixedDelayRetryStrategy(int maxAttempts, long delayMs, Clock clock) {
        Preconditions.checkArgument(maxAttempts >= 0, "maxAttempts must be >= 0");
        Preconditions.checkArgument(delayMs >= 0 && delayMs <= Integer.MAX_VALUE,
                "delayMs must fit a 32-bit message TTL: %s", delayMs);
        this.maxAttempts = maxAttempts;
        this.delayMs = delayMs;
        this.clock = clock;
    }

    @Override
    public long getDelay(int attemptCount) {
        return delayMs;
    }

    @Override
    public void setup(Channel channel, String originalQueue) throws IOException {
        WaitQueueTopology.declareRetryExchange(channel, originalQueue);
        WaitQueueTopology.declareWaitQueue(channel, Topology.waitQueue(originalQueue), originalQueue, delayMs);
        WaitQueueTopology.bindOriginalQueue(channel, originalQueue);
    }

    @Override
    public RetryAction handleFailure(Channel channel, MessageDelivery delivery) throws IOException {
        RetryMetadata.stampFailure(delivery.getHeaders(), delivery.getQueue(), clock);
        WaitQueueTopology.publishToWaitQueue(channel, Topology.waitQueue(delivery.getQueue()), delivery);
        return RetryAction.REPUBLISHED;
    }
}
