package com.example.reliablemq.model;

import java.util.Map;

import com.example.reliablemq.retry.RetryStrategy;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 消费参数
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConsumeOptions {

    /** 自动确认模式，开启后失败消息无法再路由 */
    private boolean noAck;

    private boolean exclusive;

    /** 为空时由 Broker 生成 */
    private String consumerTag;

    /** basicConsume 参数 */
    private Map<String, Object> arguments;

    private QueueOptions queueOptions;

    /** 为空时失败消息直接 nack（不重新入队） */
    private RetryStrategy retryStrategy;

    /** 为失败消息创建 <queue>.failed 死信队列 */
    private boolean enableDlq;

    /** 通道 ID，为空使用默认通道 */
    private String channelId;

    public static ConsumeOptions defaults() {
        return ConsumeOptions.builder().build();
    }
}
