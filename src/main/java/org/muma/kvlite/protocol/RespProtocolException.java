package org.muma.kvlite.protocol;

import lombok.Getter;

/**
 * 字节流无法解析为合法的 RESP 值时抛出。
 * 这类错误在命令到达执行层之前发生，所以不会有执行了一半的命令。
 */
@Getter
public class RespProtocolException extends RuntimeException {

    private final ProtocolErrorKind kind;

    public RespProtocolException(ProtocolErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }
}
