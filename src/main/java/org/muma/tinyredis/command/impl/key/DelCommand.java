package org.muma.tinyredis.command.impl.key;

import org.muma.tinyredis.command.RedisCommand;
import org.muma.tinyredis.protocol.RedisArray;
import org.muma.tinyredis.protocol.RedisInteger;
import org.muma.tinyredis.protocol.RedisMessage;
import org.muma.tinyredis.server.RedisContext;
import org.muma.tinyredis.server.RedisServerContext;

public class DelCommand implements RedisCommand {

    @Override
    public RedisMessage execute(RedisServerContext server, RedisArray args, RedisContext context) {
        // 格式: DEL key [key ...]
        if (args.size() < 2) {
            return errorArgs("del");
        }

        int deletedCount = 0;
        for (int i = 1; i < args.size(); i++) {
            if (server.getStorage().remove(args.stringAt(i))) {
                deletedCount++;
            }
        }

        return new RedisInteger(deletedCount);
    }
}
