package org.muma.kvlite.common;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

// String 类型：二进制安全的字节串
public record RedisString(byte[] bytes) implements RedisObject {

    public RedisString(String s) {
        this(s.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public RedisDataType type() {
        return RedisDataType.STRING;
    }

    public String asString() {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RedisString other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "RedisString[" + asString() + "]";
    }
}
