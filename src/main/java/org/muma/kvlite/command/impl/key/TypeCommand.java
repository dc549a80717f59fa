package org.muma.kvlite.command.impl.key;

import org.muma.kvlite.command.RedisCommand;
import org.muma.kvlite.common.RedisData;
import org.muma.kvlite.protocol.RedisArray;
import org.muma.kvlite.protocol.RedisMessage;
import org.muma.kvlite.protocol.SimpleString;
import org.muma.kvlite.store.StorageEngine;

/**
 * TYPE key
 */
public class TypeCommand implements RedisCommand {

    private static final SimpleString NONE = new SimpleString("none");

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        if (args.size() != 2) return errorArgs("type");

        RedisData data = storage.get(stringArg(args, 1));
        if (data == null) return NONE;
        return new SimpleString(data.getType().getTypeName());
    }
}
