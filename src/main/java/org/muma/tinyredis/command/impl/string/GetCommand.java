package org.muma.tinyredis.command.impl.string;

import org.muma.tinyredis.command.RedisCommand;
import org.muma.tinyredis.protocol.BulkString;
import org.muma.tinyredis.protocol.RedisArray;
import org.muma.tinyredis.protocol.RedisMessage;
import org.muma.tinyredis.server.RedisContext;
import org.muma.tinyredis.server.RedisServerContext;

public class GetCommand implements RedisCommand {

    @Override
    public RedisMessage execute(RedisServerContext server, RedisArray args, RedisContext context) {
        if (args.size() != 2) {
            return errorArgs("get");
        }

        byte[] value = server.getStorage().get(args.stringAt(1));
        if (value == null) {
            return BulkString.NULL; // Nil
        }
        return new BulkString(value);
    }
}
