package com.example.reliablemq.consumer;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import com.example.reliablemq.model.ConsumeOptions;
import com.example.reliablemq.model.MessageDelivery;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * 把 Broker 投递转交给处理线程池
 *
 * amqp-client 的分发线程只负责封装消息并提交任务，处理器在独立的工作线程中执行，
 * 同一队列最多有 prefetch 条消息并发处理。
 */
class DeliveryDispatcher extends DefaultConsumer {

    private final String queue;
    private final Executor executor;
    private final QueueConsumer owner;
    private final MessageHandler handler;
    private final ConsumeOptions options;

    DeliveryDispatcher(Channel channel, String queue, Executor executor, QueueConsumer owner,
                       MessageHandler handler, ConsumeOptions options) {
        super(channel);
        this.queue = queue;
        this.executor = executor;
        this.owner = owner;
        this.handler = handler;
        this.options = options;
    }

    @Override
    public void handleDelivery(String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
        MessageDelivery delivery = new MessageDelivery(queue, consumerTag, envelope, properties, body);
        try {
            executor.execute(() -> owner.processMessage(getChannel(), delivery, handler, options));
        } catch (RejectedExecutionException e) {
            owner.rejectUnprocessed(getChannel(), delivery, options, e);
        }
    }

    @Override
    public void handleCancel(String consumerTag) {
        owner.onBrokerCancel(queue, consumerTag);
    }

    @Override
    public void handleCancelOk(String consumerTag) {
        owner.getLogger().debug("Consumer cancel confirmed", "queue", queue, "consumerTag", consumerTag);
    }

    @Override
    public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
        if (!sig.isInitiatedByApplication()) {
            owner.getLogger().error("Consumer channel shut down", "queue", queue, "consumerTag", consumerTag, "error", sig);
        }
    }
}
