package org.muma.tinyredis.command;

import org.muma.tinyredis.protocol.ErrorMessage;
import org.muma.tinyredis.protocol.RedisArray;
import org.muma.tinyredis.protocol.RedisMessage;
import org.muma.tinyredis.server.RedisContext;
import org.muma.tinyredis.server.RedisServerContext;

public interface RedisCommand {

    /**
     * 执行命令
     *
     * @param server  共享的服务端状态 (存储引擎、Pub/Sub 注册表)
     * @param args    完整请求，elements[0] 是命令名
     * @param context 当前连接
     * @return 回复；返回 null 表示命令已经自行写出了回复 (例如 SUBSCRIBE)
     */
    RedisMessage execute(RedisServerContext server, RedisArray args, RedisContext context);

    /**
     * 辅助工具：快速构建参数错误
     */
    default ErrorMessage errorArgs(String cmd) {
        return new ErrorMessage("ERR wrong number of arguments for '" + cmd + "' command");
    }

    /**
     * 辅助工具：快速构建数值错误
     */
    default ErrorMessage errorInt() {
        return new ErrorMessage("ERR value is not an integer or out of range");
    }

    default ErrorMessage errorSyntax() {
        return new ErrorMessage("ERR syntax error");
    }
}
