package com.example.reliablemq.config;

import org.springframework.context.SmartLifecycle;
import org.springframework.retry.support.RetryTemplate;

import com.example.reliablemq.connection.RabbitConnectionManager;
import com.example.reliablemq.consumer.QueueConsumer;
import com.example.reliablemq.exception.ConnectionException;

import lombok.extern.slf4j.Slf4j;

/**
 * 随 Spring 容器启动建立连接，关闭时先停止处理线程再关闭连接
 */
@Slf4j
public class RabbitMQLifecycle implements SmartLifecycle {

    private final RabbitConnectionManager connectionManager;
    private final QueueConsumer queueConsumer;
    private final RetryTemplate connectRetryTemplate;
    private final boolean autoConnect;

    private volatile boolean running;

    public RabbitMQLifecycle(RabbitConnectionManager connectionManager, QueueConsumer queueConsumer,
                             RetryTemplate connectRetryTemplate, boolean autoConnect) {
        this.connectionManager = connectionManager;
        this.queueConsumer = queueConsumer;
        this.connectRetryTemplate = connectRetryTemplate;
        this.autoConnect = autoConnect;
    }

    @Override
    public void start() {
        if (autoConnect) {
            connectRetryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.warn("Retrying RabbitMQ connect: attempt={}", context.getRetryCount() + 1);
                }
                connectionManager.connect();
                return null;
            });
        } else {
            log.info("Auto connect disabled, call connect() manually");
        }
        running = true;
    }

    @Override
    public void stop() {
        try {
            queueConsumer.close();
            connectionManager.close();
        } catch (ConnectionException e) {
            log.error("Error while closing RabbitMQ connection: {}", e.getMessage(), e);
        } finally {
            running = false;
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
