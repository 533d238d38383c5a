package com.example.reliablemq.exception;

/**
 * 重试策略拓扑（等待队列、DLX）或死信队列准备失败
 * 在开始消费之前抛出，使配置错误在启动阶段暴露
 */
public class RetrySetupException extends MessagingException {

    public RetrySetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
