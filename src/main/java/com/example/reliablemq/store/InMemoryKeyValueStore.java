package com.example.reliablemq.store;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import com.example.reliablemq.constant.MessagingConstants.Defaults;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

import lombok.extern.slf4j.Slf4j;

/**
 * 内存实现
 *
 * 未关闭的映射永久保存；关闭后的映射放入带过期时间的 Guava Cache。
 * 生产环境建议使用 Redis 等外部存储实现 {@link KeyValueStore}。
 */
@Slf4j
public class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<String, String> openEntries = new ConcurrentHashMap<>();

    private final Cache<String, String> closedEntries;

    public InMemoryKeyValueStore() {
        this(Ticker.systemTicker(), Defaults.CLOSED_ENTRY_TTL);
    }

    public InMemoryKeyValueStore(Ticker ticker, Duration closedTtl) {
        this.closedEntries = CacheBuilder.newBuilder()
                .ticker(ticker)
                .expireAfterWrite(closedTtl.toMillis(), TimeUnit.MILLISECONDS)
                .build();
    }

    @Override
    public void set(String key, String value) {
        closedEntries.invalidate(key);
        openEntries.put(key, value);
        log.debug("Store entry saved: key={}", key);
    }

    @Override
    public Optional<String> get(String key) {
        String value = openEntries.get(key);
        if (value != null) {
            return Optional.of(value);
        }
        return Optional.ofNullable(closedEntries.getIfPresent(key));
    }

    @Override
    public void delete(String key) {
        openEntries.remove(key);
        closedEntries.invalidate(key);
        log.debug("Store entry deleted: key={}", key);
    }

    @Override
    public void markAsClosed(String key) {
        String value = openEntries.remove(key);
        if (value == null) {
            value = closedEntries.getIfPresent(key);
        }
        if (value == null) {
            // 映射不存在（可能已被删除），不做任何事
            return;
        }
        closedEntries.put(key, value);
        log.debug("Store entry marked as closed: key={}", key);
    }
}
