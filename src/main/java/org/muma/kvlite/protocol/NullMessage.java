package org.muma.kvlite.protocol;

// 6. 空值，线上格式为 $-1\r\n，与空字符串、空数组都不同
public record NullMessage() implements RedisMessage {

    public static final NullMessage INSTANCE = new NullMessage();
}
