package org.muma.kvlite.command.impl.connection;

import org.muma.kvlite.command.RedisCommand;
import org.muma.kvlite.protocol.RedisArray;
import org.muma.kvlite.protocol.RedisMessage;
import org.muma.kvlite.store.StorageEngine;

/**
 * ECHO message
 */
public class EchoCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        if (args.size() != 2) return errorArgs("echo");
        return args.elements()[1];
    }
}
