package org.muma.kvlite.command.impl.list;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.kvlite.command.impl.string.SetCommand;
import org.muma.kvlite.common.RedisDataType;
import org.muma.kvlite.common.RedisString;
import org.muma.kvlite.protocol.*;
import org.muma.kvlite.store.StorageEngine;
import org.muma.kvlite.store.impl.MemoryStorageEngine;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ListCommandTest {

    private final AtomicLong now = new AtomicLong(5_000L);

    private StorageEngine storage;
    private RPushCommand rPush;
    private LPushCommand lPush;
    private LRangeCommand lRange;
    private LLenCommand lLen;
    private SetCommand set;

    @BeforeEach
    void setUp() {
        Clock clock = mock(Clock.class);
        when(clock.millis()).thenAnswer(inv -> now.get());

        storage = new MemoryStorageEngine(clock);
        rPush = new RPushCommand();
        lPush = new LPushCommand();
        lRange = new LRangeCommand();
        lLen = new LLenCommand();
        set = new SetCommand();
    }

    private RedisArray args(String... args) {
        RedisMessage[] msgs = new RedisMessage[args.length];
        for (int i = 0; i < args.length; i++) {
            msgs[i] = new BulkString(args[i]);
        }
        return new RedisArray(msgs);
    }

    private long asLong(RedisMessage msg) {
        if (msg instanceof RedisInteger i) return i.value();
        throw new RuntimeException("Not an integer: " + msg);
    }

    private List<String> range(String key, String start, String stop) {
        RedisArray result = (RedisArray) lRange.execute(storage, args("LRANGE", key, start, stop));
        return Arrays.stream(result.elements()).map(m -> ((BulkString) m).asString()).toList();
    }

    @Test
    void testRPushKeepsArgumentOrder() {
        assertEquals(3, asLong(rPush.execute(storage, args("RPUSH", "l", "a", "b", "c"))));
        assertEquals(List.of("a", "b", "c"), range("l", "0", "-1"));

        assertEquals(4, asLong(rPush.execute(storage, args("RPUSH", "l", "d"))));
        assertEquals(List.of("a", "b", "c", "d"), range("l", "0", "-1"));
    }

    @Test
    void testLPushReversesArgumentOrder() {
        assertEquals(3, asLong(lPush.execute(storage, args("LPUSH", "l", "a", "b", "c"))));
        assertEquals(List.of("c", "b", "a"), range("l", "0", "-1"));

        // 新元素整体拼在原头部之前
        lPush.execute(storage, args("LPUSH", "l", "x", "y"));
        assertEquals(List.of("y", "x", "c", "b", "a"), range("l", "0", "-1"));
    }

    @Test
    void testPushOnStringIsWrongTypeAndLeavesValue() {
        set.execute(storage, args("SET", "k", "v"));

        RedisMessage res = rPush.execute(storage, args("RPUSH", "k", "x"));
        assertTrue(((ErrorMessage) res).content().startsWith("WRONGTYPE"));
        res = lPush.execute(storage, args("LPUSH", "k", "x"));
        assertTrue(((ErrorMessage) res).content().startsWith("WRONGTYPE"));

        assertEquals(new RedisString("v"), storage.get("k").getValue());
    }

    @Test
    void testPushOnExpiredStringCreatesList() {
        set.execute(storage, args("SET", "k", "v", "PX", "10"));
        now.addAndGet(10);

        assertEquals(1, asLong(rPush.execute(storage, args("RPUSH", "k", "x"))));
        assertEquals(RedisDataType.LIST, storage.get("k").getType());
    }

    @Test
    void testLRangeNegativeIndices() {
        rPush.execute(storage, args("RPUSH", "l", "a", "b", "c"));

        assertEquals(List.of("b", "c"), range("l", "-2", "-1"));
        assertEquals(List.of("a", "b", "c"), range("l", "-100", "-1"));
        assertEquals(List.of("a", "b"), range("l", "0", "-2"));
    }

    @Test
    void testLRangeClampsIndices() {
        rPush.execute(storage, args("RPUSH", "l", "a", "b", "c"));

        assertEquals(List.of(), range("l", "2", "1"));
        assertEquals(List.of("a", "b", "c"), range("l", "0", "100"));
        // 非负下标超过 len-1 时夹到 len-1，再比较 start 和 end
        assertEquals(List.of("c"), range("l", "5", "10"));
        assertEquals(List.of("c"), range("l", "3", "3"));
        assertEquals(List.of(), range("l", "5", "-2"));
        assertEquals(List.of("a"), range("l", "-100", "-100"));
    }

    @Test
    void testLRangeMissingKeyIsEmpty() {
        assertEquals(RedisArray.EMPTY, lRange.execute(storage, args("LRANGE", "nope", "0", "-1")));
    }

    @Test
    void testLRangeErrors() {
        rPush.execute(storage, args("RPUSH", "l", "a"));
        set.execute(storage, args("SET", "s", "v"));

        assertEquals("ERR value is not an integer or out of range",
                ((ErrorMessage) lRange.execute(storage, args("LRANGE", "l", "zero", "1"))).content());
        assertTrue(((ErrorMessage) lRange.execute(storage, args("LRANGE", "s", "0", "1"))).content().startsWith("WRONGTYPE"));
    }

    @Test
    void testLLen() {
        assertEquals(0, asLong(lLen.execute(storage, args("LLEN", "l"))));
        rPush.execute(storage, args("RPUSH", "l", "a", "b"));
        assertEquals(2, asLong(lLen.execute(storage, args("LLEN", "l"))));

        set.execute(storage, args("SET", "s", "v"));
        assertInstanceOf(ErrorMessage.class, lLen.execute(storage, args("LLEN", "s")));
    }
}
