package com.example.reliablemq.publisher;

import java.io.IOException;

import com.example.reliablemq.connection.RabbitConnectionManager;
import com.example.reliablemq.constant.MessagingConstants.ContentTypes;
import com.example.reliablemq.constant.MessagingConstants.Defaults;
import com.example.reliablemq.exception.DeclareException;
import com.example.reliablemq.exception.PublishException;
import com.example.reliablemq.exception.SerializationException;
import com.example.reliablemq.logging.MessagingLogger;
import com.example.reliablemq.model.ExchangeOptions;
import com.example.reliablemq.model.PublishOptions;
import com.example.reliablemq.model.QueueOptions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;

/**
 * 消息发布者
 *
 * 不使用 Publisher Confirm：basicPublish 返回即视为成功。
 * 目标不可路由且 mandatory=false（默认）时消息会被 Broker 静默丢弃，
 * 需要保证送达时请开启 {@link PublishOptions#isMandatory()} 或 {@link PublishOptions#isVerifyQueueExists()}。
 */
public class MessagePublisher {

    private final RabbitConnectionManager connectionManager;

    private final ObjectMapper objectMapper;

    public MessagePublisher(RabbitConnectionManager connectionManager, ObjectMapper objectMapper) {
        this.connectionManager = connectionManager;
        this.objectMapper = objectMapper;
    }

    /**
     * 发布 JSON 消息到队列（默认交换机，路由键=队列名）
     *
     * @param queue 队列名
     * @param payload 消息体，序列化为 JSON
     * @param options 发布参数，可为 null
     */
    public void publishToQueue(String queue, Object payload, PublishOptions options) {
        PublishOptions effective = options != null ? options : PublishOptions.defaults();
        checkPriority(effective);
        Channel channel = connectionManager.getChannel(effective.getChannelId());
        MessagingLogger logger = connectionManager.getLogger();

        byte[] body = serialize(payload, logger, "queue", queue);
        prepareQueue(channel, queue, effective, logger);
        send(channel, "", queue, body, ContentTypes.JSON, effective, logger);

        logger.debug("Message published to queue",
                "queue", queue,
                "payloadSize", body.length,
                "channelId", channelLabel(effective));
    }

    /**
     * 发布原始字节到队列，不做 JSON 序列化
     */
    public void publishToQueueRaw(String queue, byte[] body, PublishOptions options) {
        PublishOptions effective = options != null ? options : PublishOptions.defaults();
        checkPriority(effective);
        Channel channel = connectionManager.getChannel(effective.getChannelId());
        MessagingLogger logger = connectionManager.getLogger();

        prepareQueue(channel, queue, effective, logger);
        send(channel, "", queue, body, ContentTypes.OCTET_STREAM, effective, logger);

        logger.debug("Raw message published to queue",
                "queue", queue,
                "payloadSize", body.length,
                "channelId", channelLabel(effective));
    }

    /**
     * 发布 JSON 消息到交换机
     *
     * 交换机声明是幂等且开销小的，所以总是先声明（默认 topic、持久化）。
     */
    public void publishToExchange(String exchange, String routingKey, Object payload,
                                  ExchangeOptions exchangeOptions, PublishOptions publishOptions) {
        PublishOptions effective = publishOptions != null ? publishOptions : PublishOptions.defaults();
        ExchangeOptions exchangeOpts = exchangeOptions != null ? exchangeOptions : ExchangeOptions.defaults();
        checkPriority(effective);
        Channel channel = connectionManager.getChannel(effective.getChannelId());
        MessagingLogger logger = connectionManager.getLogger();
        byte[] body = serialize(payload, logger, "exchange", exchange);

        try {
            channel.exchangeDeclare(exchange, exchangeOpts.getType(), exchangeOpts.isDurable(),
                    exchangeOpts.isAutoDelete(), exchangeOpts.isInternal(), exchangeOpts.getArguments());
        } catch (IOException e) {
            logger.error("Failed to declare exchange",
                    "error", e, "exchange", exchange, "type", exchangeOpts.getType());
            throw new DeclareException("Failed to declare exchange " + exchange, e);
        }

        send(channel, exchange, routingKey, body, ContentTypes.JSON, effective, logger);

        logger.debug("Message published to exchange",
                "exchange", exchange,
                "routingKey", routingKey,
                "payloadSize", body.length,
                "channelId", channelLabel(effective));
    }

    private void prepareQueue(Channel channel, String queue, PublishOptions options, MessagingLogger logger) {
        if (options.isEnableQueueDeclare()) {
            QueueOptions queueOptions = options.getQueueOptions() != null
                    ? options.getQueueOptions()
                    : QueueOptions.defaults();
            try {
                channel.queueDeclare(queue, queueOptions.isDurable(), queueOptions.isExclusive(),
                        queueOptions.isAutoDelete(), queueOptions.getArguments());
            } catch (IOException e) {
                logger.error("Failed to declare queue", "error", e, "queue", queue);
                throw new DeclareException("Failed to declare queue " + queue, e);
            }
        }
        if (options.isVerifyQueueExists()) {
            connectionManager.ensureQueueExists(queue);
        }
    }

    private byte[] serialize(Object payload, MessagingLogger logger, String targetKey, String target) {
        try {
            return objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            logger.error("Failed to marshal payload", "error", e, targetKey, target);
            throw new SerializationException("Failed to marshal payload", e);
        }
    }

    private void send(Channel channel, String exchange, String routingKey, byte[] body, String contentType,
                      PublishOptions options, MessagingLogger logger) {
        AMQP.BasicProperties properties = buildProperties(contentType, options);
        try {
            channel.basicPublish(exchange, routingKey, options.isMandatory(), properties, body);
        } catch (IOException e) {
            String target = exchange.isEmpty() ? "queue " + routingKey : "exchange " + exchange;
            logger.error("Failed to publish message",
                    "error", e,
                    "exchange", exchange,
                    "routingKey", routingKey,
                    "channelId", channelLabel(options));
            throw new PublishException("Failed to publish message to " + target, e);
        }
    }

    static AMQP.BasicProperties buildProperties(String contentType, PublishOptions options) {
        AMQP.BasicProperties.Builder builder = new AMQP.BasicProperties.Builder()
                .contentType(contentType)
                .deliveryMode(options.isPersistent()
                        ? Defaults.PERSISTENT_DELIVERY_MODE
                        : Defaults.TRANSIENT_DELIVERY_MODE)
                .priority(options.getPriority())
                .headers(options.getHeaders());
        if (!Strings.isNullOrEmpty(options.getExpiration())) {
            builder.expiration(options.getExpiration());
        }
        return builder.build();
    }

    private static void checkPriority(PublishOptions options) {
        Preconditions.checkArgument(options.getPriority() >= 0 && options.getPriority() <= Defaults.MAX_PRIORITY,
                "priority must be between 0 and %s: %s", Defaults.MAX_PRIORITY, options.getPriority());
    }

    private static String channelLabel(PublishOptions options) {
        return Strings.isNullOrEmpty(options.getChannelId()) ? Defaults.DEFAULT_CHANNEL_ID : options.getChannelId();
    }
}
