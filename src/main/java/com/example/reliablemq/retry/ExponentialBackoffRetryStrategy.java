package com.example.reliablemq.retry;

import java.io.IOException;
import java.time.Clock;

import com.example.reliablemq.constant.MessagingConstants.Defaults;
import com.example.reliablemq.constant.MessagingConstants.Topology;
import com.example.reliablemq.model.MessageDelivery;
import com.google.common.base.Preconditions;
import com.rabbitmq.client.Channel;

import lombok.Getter;
import lombok.ToString;

/**
 * 指数退避重试
 *
 * delay(n) = min(initialDelayMs * multiplier^n, maxDelayMs)，浮点结果向零截断。
 * 每个重试层级一个等待队列 {@code <queue>.wait.<n>}，共 maxAttempts 个。
 * 不同层级之间的重投顺序不保证 FIFO。
 */
@Getter
@ToString(exclude = "clock")
public final class ExponentialBackoffRetryStrategy implements RetryStrategy {

    private final int maxAttempts;

    private final long initialDelayMs;

    private final double multiplier;

    private final long maxDelayMs;

    private final Clock clock;

    public ExponentialBackoffRetryStrategy(int maxAttempts, long initialDelayMs, double multiplier) {
        this(maxAttempts, initialDelayMs, multiplier, Defaults.MAX_BACKOFF_DELAY_MS);
    }

    public ExponentialBackoffRetryStrategy(int maxAttempts, long initialDelayMs, double multiplier, long maxDelayMs) {
        this(maxAttempts, initialDelayMs, multiplier, maxDelayMs, Clock.systemUTC());
    }

    public ExponentialBackoffRetryStrategy(int maxAttempts, long initialDelayMs, double multiplier,
                                           long maxDelayMs, Clock clock) {
        Preconditions.checkArgument(maxAttempts >= 0, "maxAttempts must be >= 0");
        Preconditions.checkArgument(initialDelayMs >= 0, "initialDelayMs must be >= 0");
        Preconditions.checkArgument(multiplier > 0, "multiplier must be > 0");
        Preconditions.checkArgument(maxDelayMs >= 0 && maxDelayMs <= Integer.MAX_VALUE,
                "maxDelayMs must fit a 32-bit message TTL: %s", maxDelayMs);
        this.maxAttempts = maxAttempts;
        this.initialDelayMs = initialDelayMs;
        this.multiplier = multiplier;
        this.maxDelayMs = maxDelayMs;
        this.clock = clock;
    }

    @Override
    public long getDelay(int attemptCount) {
        double delay = initialDelayMs * Math.pow(multiplier, attemptCount);
        // double -> long 向零截断，溢出时饱和到 Long.MAX_VALUE
        long truncated = (long) delay;
        return Math.min(truncated, maxDelayMs);
    }

    @Override
    public void setup(Channel channel, String originalQueue) throws IOException {
        WaitQueueTopology.declareRetryExchange(channel, originalQueue);
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            WaitQueueTopology.declareWaitQueue(channel, Topology.waitQueue(originalQueue, attempt),
                    originalQueue, getDelay(attempt));
        }
        WaitQueueTopology.bindOriginalQueue(channel, originalQueue);
    }

    /**
     * 发布到当前重试次数对应的等待队列
     *
     * @throws IllegalStateException 重试次数已用尽（不存在对应的等待队列）
     */
    @Override
    public RetryAction handleFailure(Channel channel, MessageDelivery delivery) throws IOException {
        int attemptCount = delivery.getRetryMetadata().getAttemptCount();
        if (attemptCount >= maxAttempts) {
            throw new IllegalStateException(String.format(
                    "retries exhausted for queue %s: attempt %d, maxAttempts %d",
                    delivery.getQueue(), attemptCount, maxAttempts));
        }

        String waitQueue = Topology.waitQueue(delivery.getQueue(), attemptCount);
        RetryMetadata.stampFailure(delivery.getHeaders(), delivery.getQueue(), clock);
        WaitQueueTopology.publishToWaitQueue(channel, waitQueue, delivery);
        return RetryAction.REPUBLISHED;
    }
}
