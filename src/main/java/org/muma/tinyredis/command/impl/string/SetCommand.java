package org.muma.tinyredis.command.impl.string;

import org.muma.tinyredis.command.RedisCommand;
import org.muma.tinyredis.protocol.RedisArray;
import org.muma.tinyredis.protocol.RedisMessage;
import org.muma.tinyredis.protocol.SimpleString;
import org.muma.tinyredis.server.RedisContext;
import org.muma.tinyredis.server.RedisServerContext;

public class SetCommand implements RedisCommand {

    private static final SimpleString OK = new SimpleString("OK");

    @Override
    public RedisMessage execute(RedisServerContext server, RedisArray args, RedisContext context) {
        // 支持的格式: SET key value | SET key value PX milliseconds
        int size = args.size();
        if (size < 3) {
            return errorArgs("set");
        }

        String key = args.stringAt(1);
        byte[] value = args.bytesAt(2);

        if (size == 3) {
            // 不带 PX：覆盖写入，同时清掉旧的过期时间
            server.getStorage().set(key, value);
            return OK;
        }

        if (size != 5 || !"PX".equalsIgnoreCase(args.stringAt(3))) {
            return errorSyntax();
        }

        // TTL 解析失败时不写入
        long millis;
        try {
            millis = Long.parseLong(args.stringAt(4));
        } catch (NumberFormatException e) {
            return errorInt();
        }
        if (millis == 0) {
            // PX 0 视为不带过期时间
            server.getStorage().set(key, value);
        } else {
            // 负数 TTL 也照常写入，截止时间已过，下次读取即被惰性删除
            server.getStorage().set(key, value, millis);
        }
        return OK;
    }
}
