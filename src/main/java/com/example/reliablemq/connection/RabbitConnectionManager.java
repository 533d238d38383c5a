package com.example.reliablemq.connection;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.example.reliablemq.constant.MessagingConstants.Defaults;
import com.example.reliablemq.exception.ConnectionException;
import com.example.reliablemq.exception.NotInitializedException;
import com.example.reliablemq.exception.QueueNotFoundException;
import com.example.reliablemq.logging.MessagingLogger;
import com.google.common.base.Strings;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ReturnListener;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * RabbitMQ 连接与通道管理
 *
 * 持有一个连接、一个默认通道和若干命名通道（用于生产者/消费者隔离），
 * 以及 队列名 -> consumerTag 的映射。命名通道首次请求时创建并复用；
 * 通道只归本类所有，其他组件只在单次调用内借用。
 *
 * 线程安全：
 * <ul>
 *   <li>通道映射、consumerTag 映射和队列存在性缓存由读写锁保护，读写锁只包住内存操作，
 *   持有期间不做任何 Broker 调用</li>
 *   <li>建立连接、创建命名通道和关闭由 {@code ioLock} 串行化；关闭监听器运行在客户端的
 *   读线程上，只获取读写锁，从不获取 {@code ioLock}</li>
 * </ul>
 */
public class RabbitConnectionManager implements AutoCloseable {

    private final ConnectionFactory connectionFactory;
    private final String url;
    private final int prefetch;
    private final String connectionName;
    private final MessagingLogger logger;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Lock ioLock = new ReentrantLock();
    private final Map<String, Channel> channels = new HashMap<>();
    private final Map<String, String> consumerTags = new HashMap<>();
    private final Set<String> checkedQueues = new HashSet<>();
    private final List<ReturnListener> returnListeners = new CopyOnWriteArrayList<>();

    private Connection connection;
    private Channel defaultChannel;
    private boolean closed;

    public RabbitConnectionManager(ConnectionFactory connectionFactory, String url, int prefetch,
                                   String connectionName, MessagingLogger logger) {
        this.connectionFactory = connectionFactory;
        this.url = url;
        this.prefetch = prefetch;
        this.connectionName = connectionName;
        this.logger = logger;
    }

    /**
     * 建立连接并创建默认通道，已连接时直接返回
     */
    public void connect() {
        ioLock.lock();
        try {
            if (isConnected()) {
                return;
            }

            logger.info("Connecting to RabbitMQ", "url", maskUrl(url));

            Connection newConnection;
            try {
                if (!Strings.isNullOrEmpty(url)) {
                    connectionFactory.setUri(url);
                }
                newConnection = connectionFactory.newConnection(connectionName);
            } catch (URISyntaxException | GeneralSecurityException e) {
                logger.error("Invalid RabbitMQ URL", "error", e, "url", maskUrl(url));
                throw new ConnectionException("Invalid RabbitMQ URL: " + maskUrl(url), e);
            } catch (IOException | TimeoutException e) {
                logger.error("Failed to connect to RabbitMQ", "error", e);
                throw new ConnectionException("Failed to connect to RabbitMQ", e);
            }

            Channel channel;
            try {
                channel = openChannel(newConnection, Defaults.DEFAULT_CHANNEL_ID);
            } catch (IOException e) {
                logger.error("Failed to create default channel", "error", e, "prefetch", prefetch);
                closeQuietly(newConnection);
                throw new ConnectionException("Failed to create default channel", e);
            }

            newConnection.addShutdownListener(cause -> onConnectionShutdown(cause));

            lock.writeLock().lock();
            try {
                this.connection = newConnection;
                this.defaultChannel = channel;
                this.closed = false;
            } finally {
                lock.writeLock().unlock();
            }

            logger.info("RabbitMQ connected successfully");
        } finally {
            ioLock.unlock();
        }
    }

    /**
     * 获取通道
     *
     * @param channelId 为空返回默认通道；否则返回（必要时创建）命名通道
     * @throws NotInitializedException 尚未调用 connect()
     */
    public Channel getChannel(String channelId) {
        if (Strings.isNullOrEmpty(channelId)) {
            lock.readLock().lock();
            try {
                if (defaultChannel == null) {
                    throw new NotInitializedException("Default channel not initialized. Call connect() first");
                }
                return defaultChannel;
            } finally {
                lock.readLock().unlock();
            }
        }

        Channel existing = cachedChannel(channelId);
        if (existing != null) {
            return existing;
        }

        ioLock.lock();
        try {
            // 获取 ioLock 后再检查一次，避免并发重复创建
            existing = cachedChannel(channelId);
            if (existing != null) {
                return existing;
            }
            Connection current = currentConnection();
            if (current == null) {
                throw new NotInitializedException("Connection not initialized. Call connect() first");
            }

            logger.info("Creating new named channel", "channelId", channelId);
            Channel channel;
            try {
                channel = openChannel(current, channelId);
            } catch (IOException e) {
                logger.error("Failed to create named channel", "error", e, "channelId", channelId, "prefetch", prefetch);
                throw new ConnectionException("Failed to create named channel " + channelId, e);
            }

            lock.writeLock().lock();
            try {
                channels.put(channelId, channel);
            } finally {
                lock.writeLock().unlock();
            }

            logger.info("Named channel created successfully", "channelId", channelId);
            return channel;
        } finally {
            ioLock.unlock();
        }
    }

    private Channel cachedChannel(String channelId) {
        lock.readLock().lock();
        try {
            return channels.get(channelId);
        } finally {
            lock.readLock().unlock();
        }
    }

    private Connection currentConnection() {
        lock.readLock().lock();
        try {
            return connection;
        } finally {
            lock.readLock().unlock();
        }
    }

    private Channel openChannel(Connection target, String channelId) throws IOException {
        Channel channel = target.createChannel();
        if (channel == null) {
            throw new IOException("No channel available on connection");
        }
        if (prefetch > 0) {
            try {
                channel.basicQos(prefetch);
            } catch (IOException e) {
                closeQuietly(channel);
                throw e;
            }
        }
        channel.addShutdownListener(cause -> onChannelShutdown(channel, channelId, cause));
        channel.addReturnListener((replyCode, replyText, exchange, routingKey, properties, body) ->
                onReturn(channelId, replyCode, replyText, exchange, routingKey, properties, body));
        return channel;
    }

    private void onConnectionShutdown(ShutdownSignalException cause) {
        if (cause.isInitiatedByApplication()) {
            logger.warn("RabbitMQ connection closed");
        } else {
            logger.error("RabbitMQ connection error", "error", cause);
        }
    }

    /**
     * 运行在客户端读线程上，只能做内存操作
     */
    private void onChannelShutdown(Channel channel, String channelId, ShutdownSignalException cause) {
        if (cause.isInitiatedByApplication()) {
            logger.warn("RabbitMQ channel closed", "channelId", channelId);
        } else {
            logger.error("RabbitMQ channel error", "error", cause, "channelId", channelId);
        }

        if (!Defaults.DEFAULT_CHANNEL_ID.equals(channelId)) {
            lock.writeLock().lock();
            try {
                // 只移除同一个通道实例，已重建的通道保留
                channels.remove(channelId, channel);
            } finally {
                lock.writeLock().unlock();
            }
        }
    }

    private void onReturn(String channelId, int replyCode, String replyText, String exchange, String routingKey,
                          AMQP.BasicProperties properties, byte[] body) throws IOException {
        logger.error("Message returned as unroutable",
                "channelId", channelId,
                "replyCode", replyCode,
                "replyText", replyText,
                "exchange", exchange,
                "routingKey", routingKey,
                "payloadSize", body != null ? body.length : 0);
        for (ReturnListener listener : returnListeners) {
            listener.handleReturn(replyCode, replyText, exchange, routingKey, properties, body);
        }
    }

    /**
     * 注册 mandatory 消息被退回时的回调（所有通道共享）
     */
    public void addReturnListener(ReturnListener listener) {
        returnListeners.add(listener);
    }

    /**
     * 确认队列存在（被动声明），每个队列只检查一次并缓存结果
     *
     * 被动声明失败会关闭所在通道，所以使用临时通道检查。
     *
     * @throws QueueNotFoundException 队列不存在
     */
    public void ensureQueueExists(String queue) {
        lock.readLock().lock();
        try {
            if (checkedQueues.contains(queue)) {
                return;
            }
        } finally {
            lock.readLock().unlock();
        }

        Connection current = currentConnection();
        if (current == null) {
            throw new NotInitializedException("Connection not initialized. Call connect() first");
        }

        Channel checkChannel = null;
        try {
            checkChannel = current.createChannel();
            if (checkChannel == null) {
                throw new ConnectionException("No channel available to check queue " + queue);
            }
            checkChannel.queueDeclarePassive(queue);
        } catch (IOException e) {
            logger.error("Queue does not exist - consumer must be started first", "queue", queue, "error", e);
            throw new QueueNotFoundException(queue, e);
        } finally {
            if (checkChannel != null) {
                closeQuietly(checkChannel);
            }
        }

        lock.writeLock().lock();
        try {
            checkedQueues.add(queue);
        } finally {
            lock.writeLock().unlock();
        }
        logger.debug("Queue exists - cached for future use", "queue", queue);
    }

    /**
     * 清空队列存在性缓存（测试或拓扑变更时使用）
     */
    public void clearQueueCache() {
        lock.writeLock().lock();
        try {
            checkedQueues.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void registerConsumerTag(String queue, String consumerTag) {
        lock.writeLock().lock();
        try {
            consumerTags.put(queue, consumerTag);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<String> getConsumerTag(String queue) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(consumerTags.get(queue));
        } finally {
            lock.readLock().unlock();
        }
    }

    public void removeConsumerTag(String queue) {
        lock.writeLock().lock();
        try {
            consumerTags.remove(queue);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isConnected() {
        lock.readLock().lock();
        try {
            return connection != null && defaultChannel != null && !closed;
        } finally {
            lock.readLock().unlock();
        }
    }

    public MessagingLogger getLogger() {
        return logger;
    }

    /**
     * 依次关闭所有命名通道、默认通道和连接
     *
     * 先在读写锁内摘下全部资源，再在锁外逐个关闭。
     * 单个资源关闭失败不会中断后续关闭，所有错误汇总为一个 {@link ConnectionException}
     * （各失败作为 suppressed 附加）。重复调用无副作用。
     */
    @Override
    public void close() {
        ioLock.lock();
        try {
            Map<String, Channel> named;
            Channel channel;
            Connection target;

            lock.writeLock().lock();
            try {
                if (closed) {
                    return;
                }
                named = new LinkedHashMap<>(channels);
                channels.clear();
                channel = defaultChannel;
                target = connection;
                defaultChannel = null;
                connection = null;
                consumerTags.clear();
                checkedQueues.clear();
                closed = true;
            } finally {
                lock.writeLock().unlock();
            }

            List<Exception> errors = new ArrayList<>();

            for (Map.Entry<String, Channel> entry : named.entrySet()) {
                try {
                    closeChannel(entry.getValue());
                    logger.debug("Named channel closed", "channelId", entry.getKey());
                } catch (IOException | TimeoutException | ShutdownSignalException e) {
                    logger.error("Error closing named channel", "error", e, "channelId", entry.getKey());
                    errors.add(e);
                }
            }

            if (channel != null) {
                try {
                    closeChannel(channel);
                } catch (IOException | TimeoutException | ShutdownSignalException e) {
                    logger.error("Error closing default channel", "error", e);
                    errors.add(e);
                }
            }

            if (target != null) {
                try {
                    if (target.isOpen()) {
                        target.close();
                    }
                } catch (IOException | ShutdownSignalException e) {
                    logger.error("Error closing connection", "error", e);
                    errors.add(e);
                }
            }

            logger.info("RabbitMQ connection closed");

            if (!errors.isEmpty()) {
                ConnectionException failure = new ConnectionException(
                        "errors during close: " + errors.size() + " resource(s) failed to close");
                errors.forEach(failure::addSuppressed);
                throw failure;
            }
        } finally {
            ioLock.unlock();
        }
    }

    private static void closeChannel(Channel channel) throws IOException, TimeoutException {
        if (channel.isOpen()) {
            channel.close();
        }
    }

    private void closeQuietly(Channel channel) {
        try {
            closeChannel(channel);
        } catch (IOException | TimeoutException | ShutdownSignalException e) {
            logger.debug("Ignoring error while closing channel", "error", e.getMessage());
        }
    }

    private void closeQuietly(Connection target) {
        try {
            if (target.isOpen()) {
                target.close();
            }
        } catch (IOException | ShutdownSignalException e) {
            logger.debug("Ignoring error while closing connection", "error", e.getMessage());
        }
    }

    /**
     * 隐藏 URL 中的密码
     */
    static String maskUrl(String rawUrl) {
        if (Strings.isNullOrEmpty(rawUrl)) {
            return "";
        }
        try {
            URI uri = new URI(rawUrl);
            String userInfo = uri.getUserInfo();
            if (userInfo == null || !userInfo.contains(":")) {
                return uri.toString();
            }
            String user = userInfo.substring(0, userInfo.indexOf(':'));
            return new URI(uri.getScheme(), user + ":***", uri.getHost(), uri.getPort(),
                    uri.getPath(), uri.getQuery(), uri.getFragment()).toString();
        } catch (URISyntaxException e) {
            return "invalid-url";
        }
    }
}
