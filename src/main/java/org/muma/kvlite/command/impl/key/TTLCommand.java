package org.muma.kvlite.command.impl.key;

import org.muma.kvlite.command.RedisCommand;
import org.muma.kvlite.protocol.RedisArray;
import org.muma.kvlite.protocol.RedisInteger;
import org.muma.kvlite.protocol.RedisMessage;
import org.muma.kvlite.store.StorageEngine;

/**
 * TTL key
 * 剩余秒数向上取整，1500ms -> 2
 */
public class TTLCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        if (args.size() != 2) return errorArgs("ttl");

        long millis = PTTLCommand.remainingMillis(storage, stringArg(args, 1));
        if (millis < 0) return new RedisInteger(millis);
        return new RedisInteger((millis + 999) / 1000);
    }
}
