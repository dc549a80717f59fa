package org.muma.kvlite.command.impl.string;

import org.muma.kvlite.command.RedisCommand;
import org.muma.kvlite.common.RedisData;
import org.muma.kvlite.common.RedisDataType;
import org.muma.kvlite.common.RedisString;
import org.muma.kvlite.protocol.BulkString;
import org.muma.kvlite.protocol.NullMessage;
import org.muma.kvlite.protocol.RedisArray;
import org.muma.kvlite.protocol.RedisMessage;
import org.muma.kvlite.store.StorageEngine;

public class GetCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        if (args.size() != 2) return errorArgs("get");

        RedisData data = storage.get(stringArg(args, 1));
        if (data == null) {
            return NullMessage.INSTANCE; // Nil
        }

        if (data.getType() != RedisDataType.STRING) {
            return WRONG_TYPE;
        }

        return new BulkString(data.getValue(RedisString.class).bytes());
    }
}
