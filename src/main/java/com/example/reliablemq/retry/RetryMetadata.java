package com.example.reliablemq.retry;

import java.time.Clock;
import java.util.Map;

import com.example.reliablemq.constant.MessagingConstants.Headers;
import com.rabbitmq.client.LongString;

import lombok.Value;

/**
 * 重试元数据（读写消息头部）
 *
 * 写入类型固定：x-retry-count 为 Integer（AMQP 32 位有符号），
 * x-first-failed-at 为 Long（64 位 Unix 秒）。读取时兼容其他整数宽度，
 * 字符串兼容 amqp-client 解码出的 {@link LongString}。
 */
@Value
public class RetryMetadata {

    public static final RetryMetadata EMPTY = new RetryMetadata(0, null, 0L);

    /** 已重试次数，0 表示尚未重试 */
    int attemptCount;

    String originalQueue;

    /** 首次失败时间（Unix 秒），0 表示未设置 */
    long firstFailedAt;

    public static RetryMetadata from(Map<String, Object> headers) {
        if (headers == null || headers.isEmpty()) {
            return EMPTY;
        }
        Number count = toNumber(headers.get(Headers.RETRY_COUNT));
        Number firstFailed = toNumber(headers.get(Headers.FIRST_FAILED_AT));
        Object queue = headers.get(Headers.ORIGINAL_QUEUE);
        return new RetryMetadata(
                count != null ? count.intValue() : 0,
                queue != null ? queue.toString() : null,
                firstFailed != null ? firstFailed.longValue() : 0L);
    }

    /**
     * 记录一次失败：重试次数 +1，写入来源队列，首次失败时间只写一次
     *
     * @return 更新后的元数据
     */
    public static RetryMetadata stampFailure(Map<String, Object> headers, String queue, Clock clock) {
        RetryMetadata current = from(headers);
        int nextCount = current.getAttemptCount() + 1;
        headers.put(Headers.RETRY_COUNT, Integer.valueOf(nextCount));
        headers.put(Headers.ORIGINAL_QUEUE, queue);

        long firstFailedAt = current.getFirstFailedAt();
        if (firstFailedAt == 0L) {
            firstFailedAt = clock.instant().getEpochSecond();
            headers.put(Headers.FIRST_FAILED_AT, Long.valueOf(firstFailedAt));
        }
        return new RetryMetadata(nextCount, queue, firstFailedAt);
    }

    private static Number toNumber(Object value) {
        if (value instanceof Number) {
            return (Number) value;
        }
        if (value instanceof LongString || value instanceof String) {
            try {
                return Long.valueOf(value.toString().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
