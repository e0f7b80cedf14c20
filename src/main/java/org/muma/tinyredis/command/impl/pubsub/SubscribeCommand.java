package org.muma.tinyredis.command.impl.pubsub;

import org.muma.tinyredis.command.RedisCommand;
import org.muma.tinyredis.protocol.BulkString;
import org.muma.tinyredis.protocol.RedisArray;
import org.muma.tinyredis.protocol.RedisInteger;
import org.muma.tinyredis.protocol.RedisMessage;
import org.muma.tinyredis.server.RedisContext;
import org.muma.tinyredis.server.RedisServerContext;

/**
 * SUBSCRIBE channel [channel ...]
 * 每个频道单独回复 ["subscribe", channel, count] 并立即写出，没有汇总回复。
 */
public class SubscribeCommand implements RedisCommand {

    @Override
    public RedisMessage execute(RedisServerContext server, RedisArray args, RedisContext context) {
        if (args.size() < 2) {
            return errorArgs("subscribe");
        }

        for (int i = 1; i < args.size(); i++) {
            String channel = args.stringAt(i);
            int count = server.getPubSub().subscribe(channel, context);
            context.reply(new RedisArray(new RedisMessage[]{
                    new BulkString("subscribe"),
                    new BulkString(channel),
                    new RedisInteger(count)
            }));
        }
        return null;
    }
}
