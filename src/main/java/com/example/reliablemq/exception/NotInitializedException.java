package com.example.reliablemq.exception;

/**
 * 在调用 connect() 之前获取通道、发布或消费（编程错误，不应重试）
 */
public class NotInitializedException extends MessagingException {

    public NotInitializedException(String message) {
        super(message);
    }
}
