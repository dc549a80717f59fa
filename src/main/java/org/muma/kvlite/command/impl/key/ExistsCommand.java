package org.muma.kvlite.command.impl.key;

import org.muma.kvlite.command.RedisCommand;
import org.muma.kvlite.protocol.RedisArray;
import org.muma.kvlite.protocol.RedisInteger;
import org.muma.kvlite.protocol.RedisMessage;
import org.muma.kvlite.store.StorageEngine;

/**
 * EXISTS key [key ...]
 * 同一个 Key 出现多次会被重复计数
 */
public class ExistsCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        if (args.size() < 2) return errorArgs("exists");

        long count = 0;
        for (int i = 1; i < args.size(); i++) {
            if (storage.get(stringArg(args, i)) != null) {
                count++;
            }
        }
        return new RedisInteger(count);
    }
}
