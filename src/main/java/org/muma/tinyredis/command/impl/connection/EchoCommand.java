package org.muma.tinyredis.command.impl.connection;

import org.muma.tinyredis.command.RedisCommand;
import org.muma.tinyredis.protocol.BulkString;
import org.muma.tinyredis.protocol.RedisArray;
import org.muma.tinyredis.protocol.RedisMessage;
import org.muma.tinyredis.server.RedisContext;
import org.muma.tinyredis.server.RedisServerContext;

public class EchoCommand implements RedisCommand {

    @Override
    public RedisMessage execute(RedisServerContext server, RedisArray args, RedisContext context) {
        if (args.size() != 2) {
            return errorArgs("echo");
        }
        return new BulkString(args.bytesAt(1));
    }
}
