package org.muma.kvlite.common;

import lombok.Getter;

public enum RedisDataType {
    STRING("string"),
    LIST("list");

    // TYPE 命令的返回值
    @Getter
    private final String typeName;

    RedisDataType(String typeName) {
        this.typeName = typeName;
    }
}
