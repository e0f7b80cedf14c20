package org.muma.tinyredis.utils;

/**
 * 毫秒时钟，存储引擎用它判断过期。测试里可以替换成手动推进的时钟。
 */
@FunctionalInterface
public interface Clock {

    Clock SYSTEM = System::currentTimeMillis;

    long currentTimeMillis();
}
