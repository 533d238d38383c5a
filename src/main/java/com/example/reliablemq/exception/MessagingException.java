package com.example.reliablemq.exception;

/**
 * 消息可靠性层异常基类
 */
public class MessagingException extends RuntimeException {

    public MessagingException(String message) {
        super(message);
    }

    public MessagingException(String message, Throwable cause) {
        super(message, cause);
    }
}
