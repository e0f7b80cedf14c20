package org.muma.tinyredis.server;

import lombok.Getter;
import org.muma.tinyredis.command.CommandDispatcher;
import org.muma.tinyredis.config.TinyRedisConfig;
import org.muma.tinyredis.pubsub.PubSubRegistry;
import org.muma.tinyredis.store.StorageEngine;
import org.muma.tinyredis.store.impl.MemoryStorageEngine;
import org.muma.tinyredis.utils.Clock;

/**
 * 服务器上下文
 * 启动时构造一次，显式传给每一个连接处理器；存储和 Pub/Sub 注册表都挂在这里，不走全局单例。
 */
@Getter
public class RedisServerContext {

    private final TinyRedisConfig config;
    private final StorageEngine storage;
    private final PubSubRegistry pubSub;
    private final CommandDispatcher dispatcher;

    public RedisServerContext(TinyRedisConfig config) {
        this(config, Clock.SYSTEM);
    }

    public RedisServerContext(TinyRedisConfig config, Clock clock) {
        this.config = config;

        // 1. Storage
        this.storage = new MemoryStorageEngine(clock);

        // 2. Pub/Sub
        this.pubSub = new PubSubRegistry();

        // 3. Dispatcher
        this.dispatcher = new CommandDispatcher();
    }
}
