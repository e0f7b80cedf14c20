package org.muma.tinyredis.server;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import org.muma.tinyredis.protocol.RedisMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 命令执行上下文
 * 封装了与当前连接相关的所有环境信息，同时也是这个连接在 Pub/Sub 注册表里的身份。
 * 每个连接只创建一个实例，按引用判等。
 */
public class RedisContext implements ClientConnection {

    private static final Logger log = LoggerFactory.getLogger(RedisContext.class);

    private final ChannelHandlerContext nettyCtx;
    private final String id;

    public RedisContext(ChannelHandlerContext nettyCtx) {
        this.nettyCtx = nettyCtx;
        this.id = nettyCtx.channel().id().asShortText();
    }

    public ChannelHandlerContext getNettyCtx() {
        return nettyCtx;
    }

    @Override
    public String id() {
        return id;
    }

    /**
     * 立即写出一条回复 (不等待批量)，SUBSCRIBE 的逐个确认就走这里
     */
    public void reply(RedisMessage msg) {
        nettyCtx.writeAndFlush(msg);
    }

    /**
     * 写入是异步的：这里只能同步判断连接是否还活着，
     * 真正的写失败在回调里关闭连接，随后连接处理器会把它从注册表移除。
     */
    @Override
    public boolean send(byte[] payload) {
        Channel channel = nettyCtx.channel();
        if (!channel.isActive()) {
            return false;
        }
        if (!channel.isWritable()) {
            // 慢订阅者：不堆积在出站缓冲里，这条消息直接丢弃
            log.debug("Dropped push to {}: outbound buffer above high water mark", id);
            return false;
        }
        nettyCtx.writeAndFlush(Unpooled.wrappedBuffer(payload))
                .addListener((ChannelFutureListener) future -> {
                    if (!future.isSuccess()) {
                        log.debug("Push to {} failed: {}", id, future.cause().toString());
                        future.channel().close();
                    }
                });
        return true;
    }

    @Override
    public boolean isOpen() {
        return nettyCtx.channel().isActive();
    }

    @Override
    public void close() {
        nettyCtx.close();
    }

    @Override
    public String toString() {
        return "RedisContext{" + id + ", remote=" + nettyCtx.channel().remoteAddress() + "}";
    }
}
