package com.example.reliablemq.logging;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 基于 SLF4J 的默认日志实现
 *
 * 输出格式：{@code message {queue=orders, channelId=default}}。
 * 上下文中 {@code error} 键若为异常对象，会作为 throwable 交给 SLF4J 输出堆栈。
 */
public class Slf4jMessagingLogger implements MessagingLogger {

    public static final String DEFAULT_LOGGER_NAME = "RabbitMQ";

    private static final String ERROR_KEY = "error";

    private final Logger delegate;

    public Slf4jMessagingLogger(Logger delegate) {
        this.delegate = delegate;
    }

    public static Slf4jMessagingLogger named(String name) {
        return new Slf4jMessagingLogger(LoggerFactory.getLogger(name));
    }

    public static Slf4jMessagingLogger defaultLogger() {
        return named(DEFAULT_LOGGER_NAME);
    }

    @Override
    public void info(String message, Object... context) {
        if (delegate.isInfoEnabled()) {
            Map<String, Object> fields = LogContext.from(context);
            delegate.info(format(message, fields), throwableOf(fields));
        }
    }

    @Override
    public void warn(String message, Object... context) {
        if (delegate.isWarnEnabled()) {
            Map<String, Object> fields = LogContext.from(context);
            delegate.warn(format(message, fields), throwableOf(fields));
        }
    }

    @Override
    public void error(String message, Object... context) {
        if (delegate.isErrorEnabled()) {
            Map<String, Object> fields = LogContext.from(context);
            delegate.error(format(message, fields), throwableOf(fields));
        }
    }

    @Override
    public void debug(String message, Object... context) {
        if (delegate.isDebugEnabled()) {
            Map<String, Object> fields = LogContext.from(context);
            delegate.debug(format(message, fields), throwableOf(fields));
        }
    }

    static String format(String message, Map<String, Object> fields) {
        if (fields.isEmpty()) {
            return message;
        }
        Map<String, Object> printable = new LinkedHashMap<>(fields);
        Object error = printable.get(ERROR_KEY);
        if (error instanceof Throwable throwable) {
            printable.put(ERROR_KEY, throwable.getMessage());
        }
        return message + " " + printable;
    }

    private static Throwable throwableOf(Map<String, Object> fields) {
        Object error = fields.get(ERROR_KEY);
        return error instanceof Throwable throwable ? throwable : null;
    }
}
