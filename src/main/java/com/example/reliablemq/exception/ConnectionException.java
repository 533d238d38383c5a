package com.example.reliablemq.exception;

/**
 * 连接或通道建立/关闭失败
 * 不做内部自动重连，由调用方（或启动阶段的 RetryTemplate）决定是否重试
 */
public class ConnectionException extends MessagingException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
