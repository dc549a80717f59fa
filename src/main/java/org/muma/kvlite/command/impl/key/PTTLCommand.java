package org.muma.kvlite.command.impl.key;

import org.muma.kvlite.command.RedisCommand;
import org.muma.kvlite.common.RedisData;
import org.muma.kvlite.protocol.RedisArray;
import org.muma.kvlite.protocol.RedisInteger;
import org.muma.kvlite.protocol.RedisMessage;
import org.muma.kvlite.store.StorageEngine;

/**
 * PTTL key
 * 返回剩余毫秒数；-1 表示没有过期时间，-2 表示 Key 不存在
 */
public class PTTLCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        if (args.size() != 2) return errorArgs("pttl");
        return new RedisInteger(remainingMillis(storage, stringArg(args, 1)));
    }

    static long remainingMillis(StorageEngine storage, String key) {
        RedisData data = storage.get(key);
        if (data == null) return -2;
        if (!data.hasExpire()) return -1;
        // get 已经过滤掉过期的 Key，这里一定大于 0
        return data.getExpireAt() - storage.currentTimeMillis();
    }
}
