package org.muma.tinyredis.server;

import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import org.muma.tinyredis.config.TinyRedisConfig;
import org.muma.tinyredis.protocol.RespDecoder;
import org.muma.tinyredis.protocol.RespEncoder;

/**
 * 每个新接入的连接都经过这里装配 pipeline: 解码 -> 编码 -> 命令循环
 */
public class RedisChannelInitializer extends ChannelInitializer<Channel> {

    private final RedisServerContext server;

    public RedisChannelInitializer(RedisServerContext server) {
        this.server = server;
    }

    @Override
    protected void initChannel(Channel ch) {
        TinyRedisConfig config = server.getConfig();
        ch.pipeline()
                .addLast(new RespDecoder(config.getMaxBulkLength(), config.getMaxMultiBulkLength()))
                .addLast(new RespEncoder())
                .addLast(new RedisCommandHandler(server));
    }
}
