package org.muma.kvlite.command.impl.key;

import org.muma.kvlite.command.RedisCommand;
import org.muma.kvlite.protocol.RedisArray;
import org.muma.kvlite.protocol.RedisInteger;
import org.muma.kvlite.protocol.RedisMessage;
import org.muma.kvlite.store.StorageEngine;

/**
 * DEL key [key ...]
 */
public class DelCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        if (args.size() < 2) return errorArgs("del");

        long deleted = 0;
        for (int i = 1; i < args.size(); i++) {
            String key = stringArg(args, i);
            // 先 get 触发惰性过期，已过期的 Key 不计数
            if (storage.get(key) != null && storage.remove(key)) {
                deleted++;
            }
        }
        return new RedisInteger(deleted);
    }
}
