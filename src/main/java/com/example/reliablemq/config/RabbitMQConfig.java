package com.example.reliablemq.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.retry.support.RetryTemplate;

import com.example.reliablemq.connection.RabbitConnectionManager;
import com.example.reliablemq.consumer.QueueConsumer;
import com.example.reliablemq.publisher.MessagePublisher;
import com.example.reliablemq.store.InMemoryKeyValueStore;
import com.example.reliablemq.store.KeyValueStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * 可靠消息层自动配置
 * 注册发布者、消费者、存储和生命周期组件
 */
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@Import({RabbitMQConnectionConfig.class, RetryConfig.class})
public class RabbitMQConfig {

    /**
     * JSON 序列化（支持 Java 8 时间类型）
     */
    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean
    public MessagePublisher messagePublisher(RabbitConnectionManager connectionManager, ObjectMapper objectMapper) {
        return new MessagePublisher(connectionManager, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public QueueConsumer queueConsumer(RabbitConnectionManager connectionManager, ObjectMapper objectMapper,
                                       RabbitMQProperties properties) {
        ExecutorService handlerExecutor = Executors.newFixedThreadPool(
                properties.getHandlerThreads(),
                new ThreadFactoryBuilder().setNameFormat("mq-handler-%d").setDaemon(false).build());
        return new QueueConsumer(connectionManager, objectMapper, handlerExecutor);
    }

    @Bean
    @ConditionalOnMissingBean
    public KeyValueStore keyValueStore() {
        return new InMemoryKeyValueStore();
    }

    @Bean
    public RabbitMQLifecycle rabbitMQLifecycle(RabbitConnectionManager connectionManager,
                                               QueueConsumer queueConsumer,
                                               RetryTemplate connectRetryTemplate,
                                               RabbitMQProperties properties) {
        return new RabbitMQLifecycle(connectionManager, queueConsumer, connectRetryTemplate,
                properties.isAutoConnect());
    }
}
