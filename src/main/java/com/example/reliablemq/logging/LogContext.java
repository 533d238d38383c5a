package com.example.reliablemq.logging;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 将日志上下文（键值对或单个 Map）统一转换为有序 Map
 */
public final class LogContext {

    private LogContext() {
    }

    /**
     * 解析上下文参数
     *
     * 单个 Map 参数直接复制；否则按键值对解析，非字符串键跳过，
     * 末尾落单的键丢弃。
     */
    public static Map<String, Object> from(Object... context) {
        if (context == null || context.length == 0) {
            return Collections.emptyMap();
        }

        Map<String, Object> result = new LinkedHashMap<>();

        if (context.length == 1 && context[0] instanceof Map<?, ?> map) {
            map.forEach((key, value) -> {
                if (key != null) {
                    result.put(key.toString(), value);
                }
            });
            return result;
        }

        for (int i = 0; i + 1 < context.length; i += 2) {
            if (context[i] instanceof String key) {
                result.put(key, context[i + 1]);
            }
        }
        return result;
    }
}
