package com.example.reliablemq.retry;

import java.io.IOException;
import java.time.Clock;

import com.example.reliablemq.model.MessageDelivery;
import com.google.common.base.Preconditions;
import com.rabbitmq.client.Channel;

import lombok.Getter;
import lombok.ToString;

/**
 * 立即重试：nack 并重新入队，Broker 立刻在同一队列重投
 *
 * 不需要额外拓扑。处理器持续失败时会形成紧密的重投循环，只适合能快速自愈的场景。
 * 注意 Broker 在 requeue 时保留的是原始头部，头部上的计数只对本次处理可见。
 */
@Getter
@ToString(exclude = "clock")
public final class ImmediateRetryStrategy implements RetryStrategy {

    private final int maxAttempts;

    private final Clock clock;

    public ImmediateRetryStrategy(int maxAttempts) {
        this(maxAttempts, Clock.systemUTC());
    }

    public ImmediateRetryStrategy(int maxAttempts, Clock clock) {
        Preconditions.checkArgument(maxAttempts >= 0, "maxAttempts must be >= 0");
        this.maxAttempts = maxAttempts;
        this.clock = clock;
    }

    @Override
    public long getDelay(int attemptCount) {
        return 0L;
    }

    @Override
    public void setup(Channel channel, String originalQueue) {
        // 无需拓扑
    }

    @Override
    public RetryAction handleFailure(Channel channel, MessageDelivery delivery) throws IOException {
        RetryMetadata.stampFailure(delivery.getHeaders(), delivery.getQueue(), clock);
        channel.basicNack(delivery.getDeliveryTag(), false, true);
        return RetryAction.REQUEUED;
    }
}
