package org.muma.kvlite.command.impl.list;

import org.muma.kvlite.command.RedisCommand;
import org.muma.kvlite.common.RedisData;
import org.muma.kvlite.common.RedisDataType;
import org.muma.kvlite.common.RedisList;
import org.muma.kvlite.protocol.BulkString;
import org.muma.kvlite.protocol.RedisArray;
import org.muma.kvlite.protocol.RedisMessage;
import org.muma.kvlite.store.StorageEngine;

import java.util.List;

/**
 * LRANGE key start stop
 * <p>
 * 【时间复杂度】 O(N)，N 是指定区间内的元素数量。
 * 下标夹紧规则见 {@link RedisList#range(long, long)}。
 */
public class LRangeCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        if (args.size() != 4) return errorArgs("lrange");

        String key = stringArg(args, 1);
        long start, stop;
        try {
            start = longArg(args, 2);
            stop = longArg(args, 3);
        } catch (NumberFormatException e) {
            return errorInt();
        }

        RedisData data = storage.get(key);
        if (data == null) return RedisArray.EMPTY; // 空列表
        if (data.getType() != RedisDataType.LIST) {
            return WRONG_TYPE;
        }

        List<byte[]> items = data.getValue(RedisList.class).range(start, stop);

        RedisMessage[] result = new RedisMessage[items.size()];
        for (int i = 0; i < items.size(); i++) {
            result[i] = new BulkString(items.get(i));
        }
        return new RedisArray(result);
    }
}
