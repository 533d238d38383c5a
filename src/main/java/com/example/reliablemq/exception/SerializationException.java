package com.example.reliablemq.exception;

/**
 * 消息体序列化/反序列化失败，发布被中止，不会发送任何内容
 */
public class SerializationException extends MessagingException {

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
