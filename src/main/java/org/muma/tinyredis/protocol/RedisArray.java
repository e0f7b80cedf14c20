package org.muma.tinyredis.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

// 5. 数组 (*) - elements 为 null 表示 *-1
public record RedisArray(RedisMessage[] elements) implements RedisMessage {

    public static final RedisArray NULL = new RedisArray(null);

    public static RedisArray of(RedisMessage... elements) {
        return new RedisArray(elements);
    }

    /**
     * 全部以 BulkString 形式构造，多用于命令参数与推送消息
     */
    public static RedisArray ofBulk(String... parts) {
        RedisMessage[] msgs = new RedisMessage[parts.length];
        for (int i = 0; i < parts.length; i++) {
            msgs[i] = new BulkString(parts[i]);
        }
        return new RedisArray(msgs);
    }

    public boolean isNull() {
        return elements == null;
    }

    public int size() {
        return elements == null ? 0 : elements.length;
    }

    /**
     * 以原始字节读取第 index 个参数。
     * 兼容标准请求 (BulkString) 和内联命令 (SimpleString)；参数不允许是 null 批量字符串。
     */
    public byte[] bytesAt(int index) {
        RedisMessage msg = elements[index];
        if (msg instanceof BulkString b) {
            if (b.content() == null) {
                throw new IllegalArgumentException("Protocol error: null bulk string argument");
            }
            return b.content();
        } else if (msg instanceof SimpleString s) {
            return s.content().getBytes(StandardCharsets.UTF_8);
        } else if (msg instanceof RedisInteger i) {
            return String.valueOf(i.value()).getBytes(StandardCharsets.UTF_8);
        }
        throw new IllegalArgumentException("Protocol error: invalid argument type " + msg.getClass().getSimpleName());
    }

    public String stringAt(int index) {
        return new String(bytesAt(index), StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RedisArray other)) return false;
        return Arrays.equals(elements, other.elements);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(elements);
    }

    @Override
    public String toString() {
        return elements == null ? "RedisArray[nil]" : "RedisArray" + Arrays.toString(elements);
    }
}
