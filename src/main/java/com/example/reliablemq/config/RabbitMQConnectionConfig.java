package com.example.reliablemq.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.reliablemq.connection.RabbitConnectionManager;
import com.example.reliablemq.logging.MessagingLogger;
import com.example.reliablemq.logging.Slf4jMessagingLogger;
import com.rabbitmq.client.ConnectionFactory;

/**
 * RabbitMQ 连接配置
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(RabbitMQProperties.class)
public class RabbitMQConnectionConfig {

    /**
     * 原生 amqp-client 连接工厂
     * URL 在 connect() 时设置
     */
    @Bean
    @ConditionalOnMissingBean(ConnectionFactory.class)
    public ConnectionFactory amqpConnectionFactory(RabbitMQProperties properties) {
        ConnectionFactory factory = new ConnectionFactory();

        // 连接恢复配置（关闭时由调用方负责重连）
        factory.setAutomaticRecoveryEnabled(properties.isAutomaticRecovery());
        factory.setTopologyRecoveryEnabled(properties.isAutomaticRecovery());

        // 连接超时配置
        factory.setConnectionTimeout(properties.getConnectionTimeoutMs());
        factory.setHandshakeTimeout(properties.getHandshakeTimeoutMs());

        return factory;
    }

    @Bean
    @ConditionalOnMissingBean
    public MessagingLogger messagingLogger() {
        return Slf4jMessagingLogger.defaultLogger();
    }

    @Bean
    @ConditionalOnMissingBean
    public RabbitConnectionManager rabbitConnectionManager(ConnectionFactory amqpConnectionFactory,
                                                           RabbitMQProperties properties,
                                                           MessagingLogger messagingLogger) {
        return new RabbitConnectionManager(
                amqpConnectionFactory,
                properties.getUrl(),
                properties.getPrefetch(),
                properties.getConnectionName(),
                messagingLogger);
    }
}
