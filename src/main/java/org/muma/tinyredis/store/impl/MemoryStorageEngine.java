package org.muma.tinyredis.store.impl;

import org.muma.tinyredis.store.StorageEngine;
import org.muma.tinyredis.utils.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * 内存存储引擎
 * 一把全局锁保护数据表和过期表，保证 value 与 expireAt 总是同时写入、同时清除。
 * 过期策略只有惰性删除：从未被再次读取的过期 key 不会被回收。
 */
public class MemoryStorageEngine implements StorageEngine {

    private static final Logger log = LoggerFactory.getLogger(MemoryStorageEngine.class);

    // 1. 数据存储 (Key -> Value)
    private final Map<String, byte[]> memoryDb = new HashMap<>();

    // 2. 过期时间存储 (Key -> ExpireAt Timestamp)，没有过期时间的 key 不在这里
    private final Map<String, Long> ttlMap = new HashMap<>();

    private final Object lock = new Object();
    private final Clock clock;

    public MemoryStorageEngine() {
        this(Clock.SYSTEM);
    }

    public MemoryStorageEngine(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void set(String key, byte[] value) {
        synchronized (lock) {
            memoryDb.put(key, value);
            // 不带 PX 的 SET 会去掉旧的过期时间
            ttlMap.remove(key);
        }
    }

    @Override
    public void set(String key, byte[] value, long ttlMillis) {
        long expireAt = expireAt(clock.currentTimeMillis(), ttlMillis);
        synchronized (lock) {
            memoryDb.put(key, value);
            ttlMap.put(key, expireAt);
        }
    }

    @Override
    public byte[] get(String key) {
        synchronized (lock) {
            byte[] value = memoryDb.get(key);
            if (value == null) return null;

            // 惰性删除 (Lazy Expiration)
            Long expireAt = ttlMap.get(key);
            if (expireAt != null && clock.currentTimeMillis() > expireAt) {
                memoryDb.remove(key);
                ttlMap.remove(key);
                log.debug("Key expired on access: {}", key);
                return null;
            }
            return value;
        }
    }

    @Override
    public boolean remove(String key) {
        synchronized (lock) {
            ttlMap.remove(key); // 记得同步移除 TTL
            return memoryDb.remove(key) != null;
        }
    }

    @Override
    public int size() {
        synchronized (lock) {
            return memoryDb.size();
        }
    }

    // 溢出时截断到 long 的边界，超大 TTL 等同于永不过期
    private static long expireAt(long now, long ttlMillis) {
        try {
            return Math.addExact(now, ttlMillis);
        } catch (ArithmeticException e) {
            return ttlMillis > 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
        }
    }
}
