package org.muma.kvlite.store.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.kvlite.common.RedisData;
import org.muma.kvlite.common.RedisList;
import org.muma.kvlite.common.RedisString;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class MemoryStorageEngineTest {

    private Clock clock;
    private MemoryStorageEngine storage;

    @BeforeEach
    void setUp() {
        clock = mock(Clock.class);
        when(clock.millis()).thenReturn(100L);
        storage = new MemoryStorageEngine(clock);
    }

    @Test
    void testBasicCrud() {
        storage.put("k", new RedisData(new RedisString("v")));
        assertEquals(new RedisString("v"), storage.get("k").getValue());
        assertEquals(1, storage.size());

        assertTrue(storage.remove("k"));
        assertFalse(storage.remove("k"));
        assertNull(storage.get("k"));
    }

    /**
     * 惰性删除：过期的 Key 在读取前仍占用条目，读取时才被移除
     */
    @Test
    void testLazyExpiration() {
        storage.put("k", new RedisData(new RedisString("v"), 200L));

        when(clock.millis()).thenReturn(199L);
        assertNotNull(storage.get("k"));

        when(clock.millis()).thenReturn(200L);
        assertEquals(1, storage.size(), "not removed before it is read");
        assertNull(storage.get("k"));
        assertEquals(0, storage.size());
    }

    @Test
    void testGetValueWithWrongClassThrows() {
        RedisData data = new RedisData(new RedisString("v"));
        assertThrows(IllegalStateException.class, () -> data.getValue(RedisList.class));
    }
}
