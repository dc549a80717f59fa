package org.muma.kvlite.command;

import org.muma.kvlite.protocol.BulkString;
import org.muma.kvlite.protocol.ErrorMessage;
import org.muma.kvlite.protocol.RedisArray;
import org.muma.kvlite.protocol.RedisMessage;
import org.muma.kvlite.store.StorageEngine;

import java.util.ArrayList;
import java.util.List;

public interface RedisCommand {

    ErrorMessage WRONG_TYPE = new ErrorMessage("WRONGTYPE Operation against a key holding the wrong kind of value");

    // 执行命令，传入存储引擎和参数 (args[0] 为命令名，所有元素已校验为 BulkString)
    RedisMessage execute(StorageEngine storage, RedisArray args);

    /**
     * 辅助工具：快速构建参数错误
     */
    default ErrorMessage errorArgs(String cmd) {
        return new ErrorMessage("ERR wrong number of arguments for '" + cmd + "' command");
    }

    /**
     * 辅助工具：快速构建数值错误
     */
    default ErrorMessage errorInt() {
        return new ErrorMessage("ERR value is not an integer or out of range");
    }

    default ErrorMessage errorSyntax() {
        return new ErrorMessage("ERR syntax error");
    }

    default String stringArg(RedisArray args, int index) {
        return ((BulkString) args.elements()[index]).asString();
    }

    default byte[] bytesArg(RedisArray args, int index) {
        return ((BulkString) args.elements()[index]).content();
    }

    // 从 from 开始到末尾的参数
    default List<byte[]> bytesArgs(RedisArray args, int from) {
        List<byte[]> values = new ArrayList<>(args.size() - from);
        for (int i = from; i < args.size(); i++) {
            values.add(bytesArg(args, i));
        }
        return values;
    }

    /**
     * 解析十进制有符号整数，失败抛 NumberFormatException
     */
    default long longArg(RedisArray args, int index) {
        return Long.parseLong(stringArg(args, index));
    }
}
