package com.example.reliablemq.model;

import java.util.Map;

import org.springframework.amqp.core.ExchangeTypes;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 交换机声明参数（默认：topic、持久化）
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ExchangeOptions {

    /** direct / topic / fanout / headers */
    @Builder.Default
    private String type = ExchangeTypes.TOPIC;

    @Builder.Default
    private boolean durable = true;

    private boolean autoDelete;

    private boolean internal;

    private Map<String, Object> arguments;

    public static ExchangeOptions defaults() {
        return ExchangeOptions.builder().build();
    }
}
