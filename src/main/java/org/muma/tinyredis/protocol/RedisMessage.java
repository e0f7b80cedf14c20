package org.muma.tinyredis.protocol;

/**
 * RESP 协议值 (Wire Value)
 * 密封接口，五种变体一一对应协议中的五种类型前缀。
 */
public sealed interface RedisMessage permits
        SimpleString, ErrorMessage, RedisInteger, BulkString, RedisArray {
}
