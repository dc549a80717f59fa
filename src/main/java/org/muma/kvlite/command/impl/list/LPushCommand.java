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
 * LPUSH key element [element ...]
 * <p>
 * 【时间复杂度】 O(N+K)，N 为原列表长度
 * 相当于依次 LPUSH：LPUSH mylist a b c -> c, b, a
 */
public class LPushCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        if (args.size() < 3) return errorArgs("lpush");

        String key = stringArg(args, 1);
        RedisData data = storage.get(key);
        RedisList list;

        if (data == null) {
            list = new RedisList();
            storage.put(key, new RedisData(list));
        } else {
            if (data.getType() != RedisDataType.LIST) {
                return WRONG_TYPE;
            }
            list = data.getValue(RedisList.class);
        }

        list.lpush(bytesArgs(args, 2));
        return new RedisInteger(list.size());
    }
}
