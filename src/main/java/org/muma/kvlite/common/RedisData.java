package org.muma.kvlite.common;

import lombok.Getter;
import lombok.ToString;

/**
 * 存储条目：值 + 绝对过期时间戳 (毫秒，-1 表示不过期)
 */
@Getter
@ToString
public class RedisData {

    public static final long NO_EXPIRE = -1;

    private final RedisObject value;

    private final long expireAt;

    public RedisData(RedisObject value) {
        this(value, NO_EXPIRE);
    }

    public RedisData(RedisObject value, long expireAt) {
        this.value = value;
        this.expireAt = expireAt;
    }

    public RedisDataType getType() {
        return value.type();
    }

    // 避免外部强制转换，调用前应先检查 getType()
    public <V extends RedisObject> V getValue(Class<V> clazz) {
        if (clazz.isInstance(value)) {
            return clazz.cast(value);
        }
        throw new IllegalStateException("Data type mismatch. Expected " + clazz.getSimpleName()
                + " but found " + value.getClass().getSimpleName());
    }

    public boolean hasExpire() {
        return expireAt != NO_EXPIRE;
    }

    // 当前时间到达或超过过期时间即视为不存在
    public boolean isExpired(long now) {
        return hasExpire() && now >= expireAt;
    }
}
