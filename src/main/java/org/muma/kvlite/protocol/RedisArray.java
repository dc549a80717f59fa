package org.muma.kvlite.protocol;

import java.util.Arrays;
import java.util.List;

// 5. 数组 (*)
public record RedisArray(RedisMessage[] elements) implements RedisMessage {

    public static final RedisArray EMPTY = new RedisArray(new RedisMessage[0]);

    public RedisArray {
        if (elements == null) {
            throw new IllegalArgumentException("array elements must not be null");
        }
    }

    public RedisArray(List<? extends RedisMessage> elements) {
        this(elements.toArray(new RedisMessage[0]));
    }

    public int size() {
        return elements.length;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RedisArray other && Arrays.equals(elements, other.elements);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(elements);
    }

    @Override
    public String toString() {
        return "RedisArray" + Arrays.toString(elements);
    }
}
