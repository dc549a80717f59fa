package org.muma.kvlite.store.impl;

import org.muma.kvlite.common.RedisData;
import org.muma.kvlite.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * 内存存储，只做惰性过期 (Lazy Expiration)，没有后台清理线程。
 * 时钟可注入，方便测试过期逻辑。
 */
public class MemoryStorageEngine implements StorageEngine {

    private static final Logger log = LoggerFactory.getLogger(MemoryStorageEngine.class);

    private final Map<String, RedisData> memoryDb = new HashMap<>();
    private final Clock clock;

    public MemoryStorageEngine() {
        this(Clock.systemUTC());
    }

    public MemoryStorageEngine(Clock clock) {
        this.clock = clock;
    }

    @Override
    public RedisData get(String key) {
        RedisData data = memoryDb.get(key);
        if (data == null) return null;

        if (data.isExpired(currentTimeMillis())) {
            memoryDb.remove(key);
            log.debug("Lazy expired key: {}", key);
            return null;
        }
        return data;
    }

    @Override
    public void put(String key, RedisData data) {
        memoryDb.put(key, data);
    }

    @Override
    public boolean remove(String key) {
        return memoryDb.remove(key) != null;
    }

    @Override
    public int size() {
        return memoryDb.size();
    }

    @Override
    public long currentTimeMillis() {
        return clock.millis();
    }
}
