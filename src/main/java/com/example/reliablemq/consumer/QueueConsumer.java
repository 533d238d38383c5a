package com.example.reliablemq.consumer;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import com.example.reliablemq.connection.RabbitConnectionManager;
import com.example.reliablemq.constant.MessagingConstants.Defaults;
import com.example.reliablemq.constant.MessagingConstants.Topology;
import com.example.reliablemq.exception.DeclareException;
import com.example.reliablemq.exception.HandlerException;
import com.example.reliablemq.exception.MessagingException;
import com.example.reliablemq.exception.RetrySetupException;
import com.example.reliablemq.logging.MessagingLogger;
import com.example.reliablemq.model.ConsumeOptions;
import com.example.reliablemq.model.MessageDelivery;
import com.example.reliablemq.model.QueueOptions;
import com.example.reliablemq.retry.RetryAction;
import com.example.reliablemq.retry.RetryStrategy;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * 队列消费者
 *
 * 每条消息的状态流转：
 * <pre>
 * Received -> HandlerRunning -> Success -> Acked
 *                            -> Failed  -> RetryScheduled（策略允许重试）-> Acked / 策略已 requeue
 *                                       -> RetryExhausted -> Nacked(requeue=false)（开启 DLQ 时进入 &lt;queue&gt;.failed）
 * </pre>
 * 处理器异常全部在这里捕获、记录并路由，不会中断消费。
 */
public class QueueConsumer implements AutoCloseable {

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final RabbitConnectionManager connectionManager;
    private final ObjectMapper objectMapper;
    private final ExecutorService handlerExecutor;

    /** 队列 -> 注册消费者的通道，取消时必须使用同一通道 */
    private final Map<String, Channel> consumerChannels = new ConcurrentHashMap<>();

    public QueueConsumer(RabbitConnectionManager connectionManager, ObjectMapper objectMapper,
                         ExecutorService handlerExecutor) {
        this.connectionManager = connectionManager;
        this.objectMapper = objectMapper;
        this.handlerExecutor = handlerExecutor;
    }

    /**
     * 开始消费队列
     *
     * 执行顺序：获取通道 -> 准备 DLQ（死信参数并入队列声明）-> 声明队列
     * -> 准备重试拓扑 -> basicConsume -> 登记 consumerTag。
     * 任何一步失败都在开始消费之前抛出。
     *
     * @return consumerTag
     */
    public String consumeQueue(String queue, MessageHandler handler, ConsumeOptions options) {
        ConsumeOptions effective = options != null ? options : ConsumeOptions.defaults();
        Channel channel = connectionManager.getChannel(effective.getChannelId());
        MessagingLogger logger = getLogger();
        String channelId = channelLabel(effective);

        QueueOptions queueOptions = effective.getQueueOptions() != null
                ? effective.getQueueOptions()
                : QueueOptions.defaults();

        if (effective.isEnableDlq()) {
            try {
                queueOptions = queueOptions.withArguments(DeadLetterQueueSetup.declare(channel, queue));
            } catch (IOException e) {
                logger.error("Failed to setup DLQ", "error", e, "queue", queue, "channelId", channelId);
                throw new RetrySetupException("Failed to setup DLQ for queue " + queue, e);
            }
            logger.info("DLQ setup completed", "queue", queue, "dlq", Topology.deadLetterQueue(queue));
        }

        // 队列必须先存在，重试拓扑才能绑定
        try {
            channel.queueDeclare(queue, queueOptions.isDurable(), queueOptions.isExclusive(),
                    queueOptions.isAutoDelete(), queueOptions.getArguments());
        } catch (IOException e) {
            logger.error("Failed to declare queue", "error", e, "queue", queue, "channelId", channelId);
            throw new DeclareException("Failed to declare queue " + queue, e);
        }

        RetryStrategy strategy = effective.getRetryStrategy();
        if (strategy != null) {
            try {
                strategy.setup(channel, queue);
            } catch (IOException | RuntimeException e) {
                logger.error("Failed to setup retry strategy", "error", e, "queue", queue, "channelId", channelId);
                throw new RetrySetupException("Failed to setup retry strategy for queue " + queue, e);
            }
        }

        String consumerTag;
        try {
            consumerTag = channel.basicConsume(
                    queue,
                    effective.isNoAck(),
                    Strings.nullToEmpty(effective.getConsumerTag()),
                    false,
                    effective.isExclusive(),
                    effective.getArguments(),
                    new DeliveryDispatcher(channel, queue, handlerExecutor, this, handler, effective));
        } catch (IOException e) {
            logger.error("Failed to start consuming", "error", e, "queue", queue, "channelId", channelId);
            throw new MessagingException("Failed to start consuming queue " + queue, e);
        }

        connectionManager.registerConsumerTag(queue, consumerTag);
        consumerChannels.put(queue, channel);

        logger.info("Started consuming queue",
                "queue", queue,
                "consumerTag", consumerTag,
                "channelId", channelId,
                "retryStrategy", strategy != null ? strategy.getClass().getSimpleName() : "none");
        return consumerTag;
    }

    /**
     * 消费 JSON 消息，消息体无法解析时按处理失败路由
     */
    public <T> String consumeJson(String queue, Class<T> payloadType, JsonMessageHandler<T> handler,
                                  ConsumeOptions options) {
        return consumeQueue(queue, (payload, delivery) -> {
            T value;
            try {
                value = objectMapper.readValue(payload, payloadType);
            } catch (IOException e) {
                throw new HandlerException("Failed to parse message payload as " + payloadType.getSimpleName(), e);
            }
            handler.handle(value, delivery);
        }, options);
    }

    /**
     * 取消消费（只停止新的投递，已分发的处理器继续执行完毕）
     */
    public void cancelConsumer(String queue) {
        MessagingLogger logger = getLogger();
        Optional<String> consumerTag = connectionManager.getConsumerTag(queue);
        if (consumerTag.isEmpty()) {
            logger.warn("No consumer tag found for queue", "queue", queue);
            return;
        }

        Channel channel = consumerChannels.get(queue);
        if (channel == null) {
            channel = connectionManager.getChannel(null);
        }
        try {
            channel.basicCancel(consumerTag.get());
        } catch (IOException e) {
            logger.error("Failed to cancel consumer", "error", e, "queue", queue, "consumerTag", consumerTag.get());
            throw new MessagingException("Failed to cancel consumer " + consumerTag.get(), e);
        }

        connectionManager.removeConsumerTag(queue);
        consumerChannels.remove(queue);
        logger.info("Consumer cancelled", "queue", queue, "consumerTag", consumerTag.get());
    }

    /**
     * 处理单条消息并根据结果确认
     */
    void processMessage(Channel channel, MessageDelivery delivery, MessageHandler handler, ConsumeOptions options) {
        MessagingLogger logger = getLogger();
        logger.debug("Processing message",
                "queue", delivery.getQueue(),
                "messageId", delivery.getProperties().getMessageId(),
                "retryCount", delivery.getRetryMetadata().getAttemptCount(),
                "channelId", channelLabel(options));

        try {
            handler.handle(delivery.getBody(), delivery);
        } catch (Throwable t) {
            // 任何 Throwable 都要先完成确认
            handleFailure(channel, delivery, options, t);
            if (t instanceof VirtualMachineError) {
                throw (VirtualMachineError) t;
            }
            return;
        }

        if (!options.isNoAck()) {
            ack(channel, delivery);
        }
    }

    private void handleFailure(Channel channel, MessageDelivery delivery, ConsumeOptions options, Throwable cause) {
        MessagingLogger logger = getLogger();
        String queue = delivery.getQueue();

        if (options.isNoAck()) {
            // 自动确认模式下 Broker 已经视为投递成功，无法重试或进入 DLQ
            logger.error("Message processing failed in no-ack mode, message is lost",
                    "error", cause, "queue", queue, "channelId", channelLabel(options));
            return;
        }

        RetryStrategy strategy = options.getRetryStrategy();
        if (strategy != null && strategy.shouldRetry(delivery)) {
            int attempt = delivery.getRetryMetadata().getAttemptCount();
            logger.debug("Message failed, applying retry strategy",
                    "error", cause.getMessage(), "queue", queue, "attempt", attempt);

            RetryAction action;
            try {
                action = strategy.handleFailure(channel, delivery);
            } catch (IOException | RuntimeException retryError) {
                logger.error("Failed to apply retry strategy",
                        "error", retryError, "queue", queue, "channelId", channelLabel(options));
                nack(channel, delivery, false);
                return;
            }

            if (action.requiresAck()) {
                ack(channel, delivery);
            }
            logger.warn("Message scheduled for retry",
                    "queue", queue,
                    "retryCount", attempt + 1,
                    "maxAttempts", strategy.getMaxAttempts(),
                    "delayMs", strategy.getDelay(attempt),
                    "error", cause.getMessage());
            return;
        }

        logger.error("Message processing failed, no retry",
                "error", cause,
                "queue", queue,
                "retryCount", delivery.getRetryMetadata().getAttemptCount(),
                "channelId", channelLabel(options));
        nack(channel, delivery, false);
    }

    /**
     * 线程池已关闭时无法处理，重新入队交给其他消费者
     */
    void rejectUnprocessed(Channel channel, MessageDelivery delivery, ConsumeOptions options, Exception cause) {
        getLogger().warn("Handler executor rejected delivery, requeueing",
                "queue", delivery.getQueue(), "error", cause.getMessage());
        if (!options.isNoAck()) {
            nack(channel, delivery, true);
        }
    }

    void onBrokerCancel(String queue, String consumerTag) {
        getLogger().warn("Consumer cancelled by broker", "queue", queue, "consumerTag", consumerTag);
        connectionManager.removeConsumerTag(queue);
        consumerChannels.remove(queue);
    }

    private void ack(Channel channel, MessageDelivery delivery) {
        try {
            channel.basicAck(delivery.getDeliveryTag(), false);
        } catch (IOException | ShutdownSignalException e) {
            getLogger().error("Failed to ack message",
                    "error", e, "queue", delivery.getQueue(), "deliveryTag", delivery.getDeliveryTag());
        }
    }

    private void nack(Channel channel, MessageDelivery delivery, boolean requeue) {
        try {
            channel.basicNack(delivery.getDeliveryTag(), false, requeue);
        } catch (IOException | ShutdownSignalException e) {
            getLogger().error("Failed to nack message",
                    "error", e, "queue", delivery.getQueue(), "deliveryTag", delivery.getDeliveryTag(),
                    "requeue", requeue);
        }
    }

    MessagingLogger getLogger() {
        return connectionManager.getLogger();
    }

    /**
     * 关闭处理线程池，等待已分发的处理器执行完毕
     */
    @Override
    public void close() {
        handlerExecutor.shutdown();
        try {
            if (!handlerExecutor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                getLogger().warn("Handler executor did not terminate in time",
                        "timeoutSeconds", SHUTDOWN_TIMEOUT_SECONDS);
                handlerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            handlerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static String channelLabel(ConsumeOptions options) {
        return options == null || Strings.isNullOrEmpty(options.getChannelId())
                ? Defaults.DEFAULT_CHANNEL_ID
                : options.getChannelId();
    }
}
