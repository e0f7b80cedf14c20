package org.muma.tinyredis.command.impl.pubsub;

import org.muma.tinyredis.command.RedisCommand;
import org.muma.tinyredis.protocol.BulkString;
import org.muma.tinyredis.protocol.RedisArray;
import org.muma.tinyredis.protocol.RedisInteger;
import org.muma.tinyredis.protocol.RedisMessage;
import org.muma.tinyredis.pubsub.PubSubRegistry;
import org.muma.tinyredis.server.RedisContext;
import org.muma.tinyredis.server.RedisServerContext;

import java.util.ArrayList;
import java.util.List;

/**
 * UNSUBSCRIBE [channel ...]
 * 不带参数时退订当前连接的全部频道。每个频道回复一次 ["unsubscribe", channel, count]。
 */
public class UnsubscribeCommand implements RedisCommand {

    @Override
    public RedisMessage execute(RedisServerContext server, RedisArray args, RedisContext context) {
        PubSubRegistry pubSub = server.getPubSub();

        List<String> channels = new ArrayList<>();
        for (int i = 1; i < args.size(); i++) {
            channels.add(args.stringAt(i));
        }
        if (channels.isEmpty()) {
            channels = pubSub.subscriptions(context);
        }

        // 没有任何订阅时也要给一个回复
        if (channels.isEmpty()) {
            context.reply(confirmation(BulkString.NULL, 0));
            return null;
        }

        for (String channel : channels) {
            int count = pubSub.unsubscribe(channel, context);
            context.reply(confirmation(new BulkString(channel), count));
        }
        return null;
    }

    private RedisArray confirmation(BulkString channel, int count) {
        return new RedisArray(new RedisMessage[]{
                new BulkString("unsubscribe"),
                channel,
                new RedisInteger(count)
        });
    }
}
