package com.example.reliablemq.exception;

/**
 * 业务处理失败
 *
 * 处理器可以抛出此异常（或任意异常），消费者捕获后交给重试策略决定，
 * 不会向上传播。
 */
public class HandlerException extends MessagingException {

    public HandlerException(String message) {
        super(message);
    }

    public HandlerException(String message, Throwable cause) {
        super(message, cause);
    }
}
