package org.muma.kvlite.common;

/**
 * 一个 Key 持有的值。种类在创建时确定，之后只能整体替换 (SET)，不会被隐式转换。
 */
public sealed interface RedisObject permits RedisString, RedisList {

    RedisDataType type();
}
