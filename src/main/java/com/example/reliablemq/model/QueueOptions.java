package com.example.reliablemq.model;

import java.util.HashMap;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 队列声明参数（默认：持久化、非独占、不自动删除）
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QueueOptions {

    @Builder.Default
    private boolean durable = true;

    private boolean exclusive;

    private boolean autoDelete;

    /** x-dead-letter-exchange、x-message-ttl 等队列参数 */
    private Map<String, Object> arguments;

    public static QueueOptions defaults() {
        return QueueOptions.builder().build();
    }

    /**
     * 返回合并了额外参数的新副本，不修改当前对象
     */
    public QueueOptions withArguments(Map<String, Object> extra) {
        Map<String, Object> merged = new HashMap<>();
        if (arguments != null) {
            merged.putAll(arguments);
        }
        merged.putAll(extra);
        return toBuilder().arguments(merged).build();
    }
}
