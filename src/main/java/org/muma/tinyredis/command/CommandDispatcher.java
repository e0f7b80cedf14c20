package org.muma.tinyredis.command;

import org.muma.tinyredis.command.impl.connection.EchoCommand;
import org.muma.tinyredis.command.impl.connection.PingCommand;
import org.muma.tinyredis.command.impl.connection.QuitCommand;
import org.muma.tinyredis.command.impl.key.DelCommand;
import org.muma.tinyredis.command.impl.pubsub.PublishCommand;
import org.muma.tinyredis.command.impl.pubsub.SubscribeCommand;
import org.muma.tinyredis.command.impl.pubsub.UnsubscribeCommand;
import org.muma.tinyredis.command.impl.string.GetCommand;
import org.muma.tinyredis.command.impl.string.SetCommand;
import org.muma.tinyredis.protocol.ErrorMessage;
import org.muma.tinyredis.protocol.RedisArray;
import org.muma.tinyredis.protocol.RedisMessage;
import org.muma.tinyredis.server.RedisContext;
import org.muma.tinyredis.server.RedisServerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 命令表 + 分发
 * 命令名大小写不敏感；命令层面的错误都编码成 ErrorMessage 回复，连接保持打开。
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private final Map<String, RedisCommand> commandMap = new HashMap<>();

    public CommandDispatcher() {
        this.initCommandRegistry();
    }

    /**
     * 初始化命令注册表，按类别注册
     */
    private void initCommandRegistry() {
        registerConnectionCommands();
        registerStringCommands();
        registerGenericCommands();
        registerPubSubCommands();

        log.info("CommandDispatcher initialized. Total commands registered: {}", commandMap.size());
    }

    private void registerConnectionCommands() {
        commandMap.put("PING", new PingCommand());
        commandMap.put("ECHO", new EchoCommand());
        commandMap.put("QUIT", new QuitCommand());
    }

    private void registerStringCommands() {
        commandMap.put("SET", new SetCommand());
        commandMap.put("GET", new GetCommand());
    }

    private void registerGenericCommands() {
        commandMap.put("DEL", new DelCommand());
    }

    private void registerPubSubCommands() {
        commandMap.put("SUBSCRIBE", new SubscribeCommand());
        commandMap.put("UNSUBSCRIBE", new UnsubscribeCommand());
        commandMap.put("PUBLISH", new PublishCommand());
    }

    /**
     * 核心分发逻辑
     */
    public RedisMessage dispatch(String commandName, RedisServerContext server, RedisArray args, RedisContext context) {
        // 1. 查找命令
        String cmdUpper = commandName.toUpperCase(Locale.ROOT);
        RedisCommand command = commandMap.get(cmdUpper);

        if (command == null) {
            log.warn("Command not found: {}", cmdUpper);
            return new ErrorMessage("ERR unknown command '" + cmdUpper + "'");
        }

        // 2. 执行并监控耗时
        long startTime = System.nanoTime();
        try {
            RedisMessage response = command.execute(server, args, context);

            // 记录慢日志 (比如超过 10ms)
            long duration = (System.nanoTime() - startTime) / 1000_000; // ms
            if (duration > 10) {
                log.warn("Slow command detected: {} cost {}ms", cmdUpper, duration);
            } else if (log.isDebugEnabled()) {
                log.debug("Command executed: {} cost {}ms", cmdUpper, duration);
            }

            return response;

        } catch (IllegalArgumentException e) {
            // 预期内的客户端错误 (如参数类型不对)
            log.warn("Command execution failed (Client Error): {} - {}", cmdUpper, e.getMessage());
            return new ErrorMessage("ERR " + e.getMessage());

        } catch (Exception e) {
            // 意料之外的系统错误
            log.error("Internal Server Error processing command: {}", cmdUpper, e);
            return new ErrorMessage("ERR internal server error");
        }
    }

    public boolean isRegistered(String commandName) {
        return commandMap.containsKey(commandName.toUpperCase(Locale.ROOT));
    }
}
