package org.muma.tinyredis.protocol;

// 3. 整数 (:)
public record RedisInteger(long value) implements RedisMessage {
}
