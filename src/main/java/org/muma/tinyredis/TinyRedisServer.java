package org.muma.tinyredis;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import org.muma.tinyredis.config.TinyRedisConfig;
import org.muma.tinyredis.server.RedisChannelInitializer;
import org.muma.tinyredis.server.RedisServerContext;
import org.muma.tinyredis.utils.ThreadUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

public class TinyRedisServer {

    private static final Logger log = LoggerFactory.getLogger(TinyRedisServer.class);

    private final RedisServerContext context;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public TinyRedisServer(RedisServerContext context) {
        this.context = context;
    }

    /**
     * 绑定端口后立即返回；端口配置为 0 时由系统分配，可通过 getBoundPort() 取得
     */
    public void start() throws InterruptedException {
        TinyRedisConfig config = context.getConfig();
        bossGroup = new NioEventLoopGroup(1, ThreadUtils.namedThreadFactory("tiny-redis-boss"));
        workerGroup = new NioEventLoopGroup(config.getWorkerThreads(), ThreadUtils.namedThreadFactory("tiny-redis-worker"));

        try {
            var bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    // 在 Boss 线程增加 Netty 自带的日志 Handler，可以看到 TCP 连接握手细节
                    .handler(new LoggingHandler(LogLevel.DEBUG))
                    // 开启 TCP_NODELAY (禁用 Nagle 算法)，降低延迟
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childOption(ChannelOption.SO_KEEPALIVE, true)
                    .childHandler(new RedisChannelInitializer(context));

            log.info("Starting tiny-redis server on {}:{}", config.getHost(), config.getPort());
            serverChannel = bootstrap.bind(config.getHost(), config.getPort()).sync().channel();
            log.info("tiny-redis started successfully, listening on port {}", getBoundPort());
        } catch (Exception e) {
            log.error("Failed to start server", e);
            stop();
            throw e;
        }
    }

    public int getBoundPort() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public void awaitTermination() throws InterruptedException {
        serverChannel.closeFuture().sync();
    }

    public void stop() {
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }
        log.info("tiny-redis stopped.");
    }

    public static void main(String[] args) throws InterruptedException {
        TinyRedisConfig config = TinyRedisConfig.load(args, System.getenv());
        TinyRedisServer server = new TinyRedisServer(new RedisServerContext(config));
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "tiny-redis-shutdown"));
        server.start();
        server.awaitTermination();
    }
}
