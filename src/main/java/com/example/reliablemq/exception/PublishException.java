package com.example.reliablemq.exception;

/**
 * 发布调用在传输层失败
 */
public class PublishException extends MessagingException {

    public PublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
