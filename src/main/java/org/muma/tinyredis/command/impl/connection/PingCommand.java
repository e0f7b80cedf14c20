package org.muma.tinyredis.command.impl.connection;

import org.muma.tinyredis.command.RedisCommand;
import org.muma.tinyredis.protocol.BulkString;
import org.muma.tinyredis.protocol.RedisArray;
import org.muma.tinyredis.protocol.RedisMessage;
import org.muma.tinyredis.protocol.SimpleString;
import org.muma.tinyredis.server.RedisContext;
import org.muma.tinyredis.server.RedisServerContext;

public class PingCommand implements RedisCommand {

    private static final SimpleString PONG = new SimpleString("PONG");

    @Override
    public RedisMessage execute(RedisServerContext server, RedisArray args, RedisContext context) {
        // 格式: PING [message]
        return switch (args.size()) {
            case 1 -> PONG;
            case 2 -> new BulkString(args.bytesAt(1));
            default -> errorArgs("ping");
        };
    }
}
