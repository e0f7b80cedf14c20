package org.muma.tinyredis.command.impl.pubsub;

import org.muma.tinyredis.command.RedisCommand;
import org.muma.tinyredis.protocol.RedisArray;
import org.muma.tinyredis.protocol.RedisInteger;
import org.muma.tinyredis.protocol.RedisMessage;
import org.muma.tinyredis.server.RedisContext;
import org.muma.tinyredis.server.RedisServerContext;

public class PublishCommand implements RedisCommand {

    @Override
    public RedisMessage execute(RedisServerContext server, RedisArray args, RedisContext context) {
        // 格式: PUBLISH channel message
        if (args.size() != 3) {
            return errorArgs("publish");
        }

        int delivered = server.getPubSub().publish(args.stringAt(1), args.bytesAt(2));
        return new RedisInteger(delivered);
    }
}
