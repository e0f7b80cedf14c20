package org.muma.tinyredis.server;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import org.muma.tinyredis.protocol.BulkString;
import org.muma.tinyredis.protocol.ErrorMessage;
import org.muma.tinyredis.protocol.RedisArray;
import org.muma.tinyredis.protocol.RedisInteger;
import org.muma.tinyredis.protocol.RedisMessage;
import org.muma.tinyredis.protocol.SimpleString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 单个连接的命令循环
 * 每个连接一个实例，固定运行在同一个 EventLoop 线程上，因此同一连接内的请求严格按序处理。
 * 连接结束 (正常断开、I/O 错误、协议错误) 时：先从 Pub/Sub 注册表移除，再关闭连接。
 */
public class RedisCommandHandler extends SimpleChannelInboundHandler<RedisMessage> {

    private static final Logger log = LoggerFactory.getLogger(RedisCommandHandler.class);

    // 记录连接的客户端数量
    private static final AtomicInteger connectedClients = new AtomicInteger();

    private final RedisServerContext server;
    private RedisContext context;

    public RedisCommandHandler(RedisServerContext server) {
        this.server = server;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        this.context = new RedisContext(ctx);
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        log.info("Client connected: {}, total clients: {}", ctx.channel().remoteAddress(), connectedClients.incrementAndGet());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        teardown(ctx);
        log.info("Client disconnected: {}, total clients: {}", ctx.channel().remoteAddress(), connectedClients.decrementAndGet());
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RedisMessage msg) {
        // 只有数组才是命令，其它类型直接丢弃 (应用层格式问题，不是致命错误)
        if (!(msg instanceof RedisArray array) || array.isNull() || array.size() == 0) {
            log.debug("Discarding non-command message from {}: {}", context.id(), msg);
            return;
        }

        String commandName = commandName(array.elements()[0]);
        if (commandName == null) {
            log.debug("Discarding request without command name from {}", context.id());
            return;
        }

        RedisMessage response = server.getDispatcher().dispatch(commandName, server, array, context);
        if (response != null) {
            ctx.writeAndFlush(response);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof DecoderException) {
            log.warn("Protocol error from {}, closing connection: {}", context.id(), cause.getMessage());
        } else if (cause instanceof IOException) {
            log.debug("I/O error on {}: {}", context.id(), cause.getMessage());
        } else {
            log.error("Unexpected error on {}", context.id(), cause);
        }
        teardown(ctx);
    }

    private void teardown(ChannelHandlerContext ctx) {
        server.getPubSub().removeConnection(context);
        ctx.close();
    }

    // 命令名可能来自 BulkString (标准请求) 或 SimpleString (内联命令)，缺失时返回 null
    private String commandName(RedisMessage first) {
        if (first instanceof BulkString b) {
            return b.asString();
        } else if (first instanceof SimpleString s) {
            return s.content();
        } else if (first instanceof RedisInteger i) {
            return String.valueOf(i.value());
        } else if (first instanceof ErrorMessage || first instanceof RedisArray) {
            return null;
        }
        throw new IllegalStateException("Unknown RESP value: " + first);
    }
}
