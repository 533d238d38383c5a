package com.example.reliablemq.logging;

/**
 * 消息层使用的日志能力
 *
 * 上下文参数支持两种写法：
 * <ol>
 *   <li>键值对：{@code logger.info("msg", "queue", queue, "channelId", id)}</li>
 *   <li>单个 Map：{@code logger.info("msg", Map.of("queue", queue))}</li>
 * </ol>
 * 实现不能阻塞消息处理。
 */
public interface MessagingLogger {

    void info(String message, Object... context);

    void warn(String message, Object... context);

    void error(String message, Object... context);

    void debug(String message, Object... context);
}
