package org.muma.kvlite.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Redis List 封装类
 * 底层采用 ArrayList，插入顺序即列表顺序。
 */
public final class RedisList implements RedisObject {

    private final List<byte[]> elements = new ArrayList<>();

    @Override
    public RedisDataType type() {
        return RedisDataType.LIST;
    }

    /**
     * 头部插入 (LPUSH)
     * 多个元素依次推入头部：lpush(a, b, c) 之后列表为 c, b, a, ...
     */
    public void lpush(List<byte[]> values) {
        List<byte[]> reversed = new ArrayList<>(values);
        Collections.reverse(reversed);
        elements.addAll(0, reversed);
    }

    /**
     * 尾部插入 (RPUSH)
     */
    public void rpush(List<byte[]> values) {
        elements.addAll(values);
    }

    /**
     * 获取长度 (LLEN)
     */
    public int size() {
        return elements.size();
    }

    /**
     * 范围查询 (LRANGE)，闭区间
     * <p>
     * 先各自夹紧到 [0, len-1]，再比较：
     * 负数从尾部计数 (-1 为最后一个)，非负数超过 len-1 时夹到 len-1。
     * 所以 start >= len 不会直接返回空，而是落在最后一个元素上。
     */
    public List<byte[]> range(long start, long stop) {
        int len = elements.size();
        if (len == 0) {
            return Collections.emptyList();
        }

        int startIdx = clamp(start, len);
        int endIdx = clamp(stop, len);
        if (startIdx > endIdx) {
            return Collections.emptyList();
        }
        return new ArrayList<>(elements.subList(startIdx, endIdx + 1));
    }

    private static int clamp(long index, int len) {
        if (index < 0) {
            return (int) Math.max(0, len + index);
        }
        return (int) Math.min(len - 1, index);
    }
}
