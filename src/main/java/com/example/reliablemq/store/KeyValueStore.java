package com.example.reliablemq.store;

import java.util.Optional;

/**
 * 键值存储能力（供上层应用做幂等的资源映射，重试核心本身不使用）
 */
public interface KeyValueStore {

    /**
     * 保存映射，不设置过期时间
     */
    void set(String key, String value);

    Optional<String> get(String key);

    void delete(String key);

    /**
     * 标记为已关闭：保留现有值并设置 7 天过期，键不存在时不做任何事
     */
    void markAsClosed(String key);
}
