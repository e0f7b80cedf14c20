package org.muma.tinyredis.protocol;

// 2. 错误 (-)，独立的类型，不是异常
public record ErrorMessage(String content) implements RedisMessage {
}
