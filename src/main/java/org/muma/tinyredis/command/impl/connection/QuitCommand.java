package org.muma.tinyredis.command.impl.connection;

import io.netty.channel.ChannelFutureListener;
import org.muma.tinyredis.command.RedisCommand;
import org.muma.tinyredis.protocol.RedisArray;
import org.muma.tinyredis.protocol.RedisMessage;
import org.muma.tinyredis.protocol.SimpleString;
import org.muma.tinyredis.server.RedisContext;
import org.muma.tinyredis.server.RedisServerContext;

/**
 * QUIT: 先回 +OK，写完后关闭连接
 */
public class QuitCommand implements RedisCommand {

    @Override
    public RedisMessage execute(RedisServerContext server, RedisArray args, RedisContext context) {
        context.getNettyCtx()
                .writeAndFlush(new SimpleString("OK"))
                .addListener(ChannelFutureListener.CLOSE);
        return null;
    }
}
