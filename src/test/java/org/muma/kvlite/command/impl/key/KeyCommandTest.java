package org.muma.kvlite.command.impl.key;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.kvlite.command.impl.list.RPushCommand;
import org.muma.kvlite.command.impl.string.SetCommand;
import org.muma.kvlite.protocol.*;
import org.muma.kvlite.store.StorageEngine;
import org.muma.kvlite.store.impl.MemoryStorageEngine;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class KeyCommandTest {

    private final AtomicLong now = new AtomicLong(0L);

    private StorageEngine storage;
    private SetCommand set;
    private RPushCommand rPush;

    @BeforeEach
    void setUp() {
        Clock clock = mock(Clock.class);
        when(clock.millis()).thenAnswer(inv -> now.get());

        storage = new MemoryStorageEngine(clock);
        set = new SetCommand();
        rPush = new RPushCommand();
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

    @Test
    void testDel() {
        DelCommand del = new DelCommand();
        set.execute(storage, args("SET", "a", "1"));
        rPush.execute(storage, args("RPUSH", "b", "x"));

        assertEquals(2, asLong(del.execute(storage, args("DEL", "a", "b", "c"))));
        assertEquals(0, storage.size());
        assertEquals(0, asLong(del.execute(storage, args("DEL", "a"))));
    }

    @Test
    void testDelDoesNotCountExpiredKey() {
        DelCommand del = new DelCommand();
        set.execute(storage, args("SET", "a", "1", "PX", "5"));
        now.set(5);

        assertEquals(0, asLong(del.execute(storage, args("DEL", "a"))));
    }

    @Test
    void testExists() {
        ExistsCommand exists = new ExistsCommand();
        set.execute(storage, args("SET", "a", "1"));

        assertEquals(1, asLong(exists.execute(storage, args("EXISTS", "a"))));
        assertEquals(2, asLong(exists.execute(storage, args("EXISTS", "a", "a", "missing"))));
        assertInstanceOf(ErrorMessage.class, exists.execute(storage, args("EXISTS")));
    }

    @Test
    void testType() {
        TypeCommand type = new TypeCommand();
        set.execute(storage, args("SET", "s", "v"));
        rPush.execute(storage, args("RPUSH", "l", "x"));

        assertEquals(new SimpleString("string"), type.execute(storage, args("TYPE", "s")));
        assertEquals(new SimpleString("list"), type.execute(storage, args("TYPE", "l")));
        assertEquals(new SimpleString("none"), type.execute(storage, args("TYPE", "missing")));
    }

    @Test
    void testTtlAndPttl() {
        TTLCommand ttl = new TTLCommand();
        PTTLCommand pttl = new PTTLCommand();

        set.execute(storage, args("SET", "forever", "v"));
        set.execute(storage, args("SET", "temp", "v", "PX", "1500"));

        assertEquals(-2, asLong(ttl.execute(storage, args("TTL", "missing"))));
        assertEquals(-1, asLong(ttl.execute(storage, args("TTL", "forever"))));
        assertEquals(2, asLong(ttl.execute(storage, args("TTL", "temp"))));
        assertEquals(1500, asLong(pttl.execute(storage, args("PTTL", "temp"))));

        now.set(1000);
        assertEquals(500, asLong(pttl.execute(storage, args("PTTL", "temp"))));
        assertEquals(1, asLong(ttl.execute(storage, args("TTL", "temp"))));

        now.set(1500);
        assertEquals(-2, asLong(pttl.execute(storage, args("PTTL", "temp"))));
    }
}
