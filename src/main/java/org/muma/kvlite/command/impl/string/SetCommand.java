package org.muma.kvlite.command.impl.string;

import org.muma.kvlite.command.RedisCommand;
import org.muma.kvlite.common.RedisData;
import org.muma.kvlite.common.RedisString;
import org.muma.kvlite.protocol.ErrorMessage;
import org.muma.kvlite.protocol.RedisArray;
import org.muma.kvlite.protocol.RedisMessage;
import org.muma.kvlite.protocol.SimpleString;
import org.muma.kvlite.store.StorageEngine;

import java.util.Locale;

/**
 * SET key value [EX seconds | PX milliseconds]
 * <p>
 * 总是整体替换旧值 (包括类型和过期时间)，不检查旧值。
 * 选项名不区分大小写。
 */
public class SetCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        if (args.size() < 3) return errorArgs("set");

        String key = stringArg(args, 1);
        byte[] value = bytesArg(args, 2);

        // --- 1. 参数解析阶段，全部校验通过前不修改存储 ---
        long expireAt = RedisData.NO_EXPIRE;
        boolean expireSeen = false;

        for (int i = 3; i < args.size(); i++) {
            String opt = stringArg(args, i).toUpperCase(Locale.ROOT);
            long unitMillis = switch (opt) {
                case "EX" -> 1000L;
                case "PX" -> 1L;
                default -> -1L;
            };
            // 未知选项；EX 和 PX 最多出现一个；缺少数值参数
            if (unitMillis < 0 || expireSeen || i + 1 >= args.size()) return errorSyntax();
            expireSeen = true;

            long amount;
            try {
                amount = longArg(args, ++i);
            } catch (NumberFormatException e) {
                return errorInt();
            }
            if (amount < 0) return invalidExpire();

            try {
                expireAt = Math.addExact(storage.currentTimeMillis(), Math.multiplyExact(amount, unitMillis));
            } catch (ArithmeticException e) {
                return invalidExpire();
            }
        }

        // --- 2. 写入阶段 ---
        storage.put(key, new RedisData(new RedisString(value), expireAt));
        return SimpleString.OK;
    }

    private ErrorMessage invalidExpire() {
        return new ErrorMessage("ERR invalid expire time in 'set' command");
    }
}
