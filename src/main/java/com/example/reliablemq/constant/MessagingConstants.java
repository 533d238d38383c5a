package com.example.reliablemq.constant;

import java.time.Duration;

/**
 * 消息可靠性层相关常量定义
 *
 * 统一管理重试头部、拓扑命名后缀、队列参数、默认配置等常量。
 * 头部键与拓扑命名需与已部署的运维工具保持一致，不可随意修改。
 */
public final class MessagingConstants {

    private MessagingConstants() {
    }

    /**
     * 重试元数据头部（随消息在每次重投之间传递）
     */
    public static final class Headers {
        /** 已重试次数，32 位整数，从 0 开始 */
        public static final String RETRY_COUNT = "x-retry-count";

        /** 消息来源队列 */
        public static final String ORIGINAL_QUEUE = "x-original-queue";

        /** 首次失败时间（Unix 秒，64 位），只写一次 */
        public static final String FIRST_FAILED_AT = "x-first-failed-at";

        private Headers() {
        }
    }

    /**
     * Broker 拓扑命名后缀
     */
    public static final class Topology {
        /** 重试用死信交换机：{@code <queue>.dlx} */
        public static final String RETRY_DLX_SUFFIX = ".dlx";

        /** 等待队列：{@code <queue>.wait}，指数退避为 {@code <queue>.wait.<i>} */
        public static final String WAIT_QUEUE_SUFFIX = ".wait";

        /** 死信队列：{@code <queue>.failed} */
        public static final String DLQ_SUFFIX = ".failed";

        /** 死信队列交换机：{@code <queue>.failed.dlx} */
        public static final String DLQ_EXCHANGE_SUFFIX = ".failed.dlx";

        private Topology() {
        }

        public static String retryExchange(String queue) {
            return queue + RETRY_DLX_SUFFIX;
        }

        public static String waitQueue(String queue) {
            return queue + WAIT_QUEUE_SUFFIX;
        }

        public static String waitQueue(String queue, int attempt) {
            return queue + WAIT_QUEUE_SUFFIX + "." + attempt;
        }

        public static String deadLetterQueue(String queue) {
            return queue + DLQ_SUFFIX;
        }

        public static String deadLetterExchange(String queue) {
            return queue + DLQ_EXCHANGE_SUFFIX;
        }
    }

    /**
     * 队列声明参数
     */
    public static final class QueueArguments {
        public static final String DEAD_LETTER_EXCHANGE = "x-dead-letter-exchange";
        public static final String DEAD_LETTER_ROUTING_KEY = "x-dead-letter-routing-key";
        public static final String MESSAGE_TTL = "x-message-ttl";

        private QueueArguments() {
        }
    }

    /**
     * 消息内容类型
     */
    public static final class ContentTypes {
        public static final String JSON = "application/json";
        public static final String OCTET_STREAM = "application/octet-stream";

        private ContentTypes() {
        }
    }

    /**
     * 默认配置
     */
    public static final class Defaults {
        /** 默认通道 ID（日志展示用） */
        public static final String DEFAULT_CHANNEL_ID = "default";

        /** 指数退避默认最大延迟：5 分钟 */
        public static final long MAX_BACKOFF_DELAY_MS = 300_000L;

        /** 消息优先级上限 */
        public static final int MAX_PRIORITY = 9;

        /** Store 关闭标记后的保留时间 */
        public static final Duration CLOSED_ENTRY_TTL = Duration.ofDays(7);

        /** 持久化投递模式 */
        public static final int PERSISTENT_DELIVERY_MODE = 2;

        /** 非持久化投递模式 */
        public static final int TRANSIENT_DELIVERY_MODE = 1;

        private Defaults() {
        }
    }
}
