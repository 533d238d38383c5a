package com.example.reliablemq.consumer;

import com.example.reliablemq.model.MessageDelivery;

/**
 * 消息处理器
 *
 * 抛出任何异常都视为处理失败，交给重试策略决定后续路由，不会中断消费。
 */
@FunctionalInterface
public interface MessageHandler {

    void handle(byte[] payload, MessageDelivery delivery) throws Exception;
}
