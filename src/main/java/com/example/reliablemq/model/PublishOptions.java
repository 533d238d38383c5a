package com.example.reliablemq.model;

import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 消息发布参数
 *
 * 默认不声明队列（假设消费端已创建好带死信参数的队列），
 * 避免生产端声明参数不一致导致 PRECONDITION_FAILED。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PublishOptions {

    /** 持久化投递（delivery-mode=2） */
    @Builder.Default
    private boolean persistent = true;

    /** 优先级 0-9 */
    @Builder.Default
    private int priority = 0;

    /** 消息过期时间（毫秒字符串） */
    private String expiration;

    private Map<String, Object> headers;

    /** 仅在 enableQueueDeclare=true 时使用，为空则使用默认队列参数 */
    private QueueOptions queueOptions;

    /** 发布前声明队列，默认关闭 */
    private boolean enableQueueDeclare;

    /** 发布前被动检查队列是否存在（结果按队列缓存） */
    private boolean verifyQueueExists;

    /**
     * mandatory 标志
     *
     * 默认 false：无法路由的消息会被 Broker 静默丢弃（已知的可靠性缺口）。
     * 设为 true 时 Broker 会退回消息，由连接上的 ReturnListener 记录。
     */
    private boolean mandatory;

    /** 通道 ID，为空使用默认通道 */
    private String channelId;

    public static PublishOptions defaults() {
        return PublishOptions.builder().build();
    }
}
