package com.example.reliablemq.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

import com.example.reliablemq.exception.ConnectionException;

/**
 * Spring Retry 配置
 *
 * 只用于启动阶段建立连接；消息级重试由 {@link com.example.reliablemq.retry.RetryStrategy} 负责。
 */
@Configuration(proxyBeanMethods = false)
public class RetryConfig {

    @Bean
    @ConditionalOnMissingBean(name = "connectRetryTemplate")
    public RetryTemplate connectRetryTemplate(RabbitMQProperties properties) {
        RabbitMQProperties.ConnectRetry retry = properties.getConnectRetry();
        return RetryTemplate.builder()
                .maxAttempts(retry.getMaxAttempts())
                .exponentialBackoff(retry.getInitialIntervalMs(), retry.getMultiplier(), retry.getMaxIntervalMs())
                .retryOn(ConnectionException.class)
                .build();
    }
}
