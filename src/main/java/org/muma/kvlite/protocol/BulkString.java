package org.muma.kvlite.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

// 4. 批量字符串 ($)，二进制安全。空值用 NullMessage 表示 ($-1)
public record BulkString(byte[] content) implements RedisMessage {

    public BulkString {
        if (content == null) {
            throw new IllegalArgumentException("bulk string content must not be null, use NullMessage");
        }
    }

    public BulkString(String s) {
        this(s.getBytes(StandardCharsets.UTF_8));
    }

    public String asString() {
        return new String(content, StandardCharsets.UTF_8);
    }

    // record 默认按引用比较数组，这里改为按内容比较
    @Override
    public boolean equals(Object o) {
        return o instanceof BulkString other && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "BulkString[" + asString() + "]";
    }
}
