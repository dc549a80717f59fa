package org.muma.kvlite.command.impl.connection;

import org.muma.kvlite.command.RedisCommand;
import org.muma.kvlite.protocol.RedisArray;
import org.muma.kvlite.protocol.RedisMessage;
import org.muma.kvlite.protocol.SimpleString;
import org.muma.kvlite.store.StorageEngine;

/**
 * PING
 */
public class PingCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        if (args.size() != 1) return errorArgs("ping");
        return SimpleString.PONG;
    }
}
