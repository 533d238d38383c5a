package com.example.reliablemq.consumer;

import com.example.reliablemq.model.MessageDelivery;

/**
 * 接收已反序列化 JSON 消息体的处理器
 */
@FunctionalInterface
public interface JsonMessageHandler<T> {

    void handle(T payload, MessageDelivery delivery) throws Exception;
}
