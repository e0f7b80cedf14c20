package org.muma.tinyredis.server;

/**
 * 一个客户端连接的抽象：能接收原始字节、能报告写失败、能被关闭。
 * Pub/Sub 注册表只持有它的引用做查找和推送，连接的生命周期归连接处理器管理。
 */
public interface ClientConnection {

    String id();

    /**
     * 推送已编码好的字节
     *
     * @return 消息没有发出时返回 false (连接已断开，或写缓冲已满被丢弃)
     */
    boolean send(byte[] payload);

    /**
     * 连接是否仍然存活；send 失败但连接仍存活，说明只是这条消息被丢弃
     */
    boolean isOpen();

    void close();
}
