package org.muma.tinyredis.store;

/**
 * 键值存储引擎
 * 所有操作彼此之间都是原子的 (线性一致)：读到的要么是完整的旧状态，要么是完整的新状态。
 */
public interface StorageEngine {

    /**
     * 无条件覆盖写入，并清除该 key 之前的过期时间
     */
    void set(String key, byte[] value);

    /**
     * 覆盖写入，过期时间 = 当前时间 + ttlMillis
     */
    void set(String key, byte[] value, long ttlMillis);

    /**
     * 读取。已过期的 key 在这里被惰性删除并返回 null。
     */
    byte[] get(String key);

    /**
     * 删除 key 及其过期时间
     *
     * @return key 删除前是否存在
     */
    boolean remove(String key);

    // 当前保存的条目数 (包含已过期但还没被读到的 key)
    int size();
}
