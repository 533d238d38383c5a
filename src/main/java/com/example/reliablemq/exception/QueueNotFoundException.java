package com.example.reliablemq.exception;

/**
 * 被动检查时队列不存在（消费端需先启动以创建队列拓扑）
 */
public class QueueNotFoundException extends DeclareException {

    private final String queue;

    public QueueNotFoundException(String queue, Throwable cause) {
        super("Queue '" + queue + "' does not exist. Consumer must be started first to create queue infrastructure", cause);
        this.queue = queue;
    }

    public String getQueue() {
        return queue;
    }
}
