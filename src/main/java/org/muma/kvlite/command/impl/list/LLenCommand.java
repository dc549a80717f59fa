package org.muma.kvlite.command.impl.list;

import org.muma.kvlite.command.RedisCommand;
import org.muma.kvlite.common.RedisData;
import org.muma.kvlite.common.RedisDataType;
import org.muma.kvlite.common.RedisList;
import org.muma.kvlite.protocol.RedisArray;
import org.muma.kvlite.protocol.RedisInteger;
import org.muma.kvlite.protocol.RedisMessage;
import org.muma.kvlite.store.StorageEngine;

/**
 * LLEN key
 */
public class LLenCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        if (args.size() != 2) return errorArgs("llen");

        RedisData data = storage.get(stringArg(args, 1));
        if (data == null) return new RedisInteger(0);
        if (data.getType() != RedisDataType.LIST) {
            return WRONG_TYPE;
        }
        return new RedisInteger(data.getValue(RedisList.class).size());
    }
}
