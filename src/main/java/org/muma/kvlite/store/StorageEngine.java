package org.muma.kvlite.store;

import org.muma.kvlite.common.RedisData;

/**
 * Key -> RedisData 的存储。
 * 实现不做并发控制，调用方需保证同一个实例不会被并发执行 (参见 RedisCoreExecutor)。
 */
public interface StorageEngine {

    /**
     * 读取 Key。已过期的 Key 在这里被惰性删除并返回 null。
     */
    RedisData get(String key);

    // 整体替换，不检查旧值
    void put(String key, RedisData data);

    boolean remove(String key);

    // 物理条目数，可能包含尚未被惰性删除的过期 Key
    int size();

    // 过期判断使用的当前时间 (毫秒)
    long currentTimeMillis();
}
