package org.muma.kvlite.protocol;

// 密封接口，六种 RESP 值
public sealed interface RedisMessage permits
        SimpleString, ErrorMessage, RedisInteger, BulkString, RedisArray, NullMessage {
}
