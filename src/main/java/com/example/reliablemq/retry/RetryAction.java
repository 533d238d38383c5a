package com.example.reliablemq.retry;

/**
 * 重试策略处理失败消息后的结果，决定消费者是否还需要确认原消息
 */
public enum RetryAction {

    /** 策略已 nack(requeue=true)，消费者不能再确认 */
    REQUEUED,

    /** 已重新发布到等待队列，消费者需 ack 原消息 */
    REPUBLISHED;

    public boolean requiresAck() {
        return this == REPUBLISHED;
    }
}
