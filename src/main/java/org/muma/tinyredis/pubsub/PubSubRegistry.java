package org.muma.tinyredis.pubsub;

import org.muma.tinyredis.protocol.BulkString;
import org.muma.tinyredis.protocol.RedisArray;
import org.muma.tinyredis.protocol.RedisMessage;
import org.muma.tinyredis.server.ClientConnection;
import org.muma.tinyredis.utils.RespCodecUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 发布/订阅注册表
 * Channel -> 有序、去重的订阅者集合。频道在第一个订阅者出现时创建，集合变空时删除。
 * 所有操作共用一把锁；publish 在锁内拍快照，锁外推送，再回到锁内清理推送失败的订阅者。
 */
public class PubSubRegistry {

    private static final Logger log = LoggerFactory.getLogger(PubSubRegistry.class);

    private static final byte[] MESSAGE = "message".getBytes(StandardCharsets.UTF_8);

    private final Map<String, Set<ClientConnection>> channels = new HashMap<>();
    private final Object lock = new Object();

    /**
     * 订阅 (幂等)
     *
     * @return 该连接当前订阅的频道总数 (整个注册表范围，而不是这个频道的订阅人数)
     */
    public int subscribe(String channel, ClientConnection conn) {
        synchronized (lock) {
            channels.computeIfAbsent(channel, k -> new LinkedHashSet<>()).add(conn);
            return countSubscriptions(conn);
        }
    }

    /**
     * @return 退订后该连接剩余的频道数
     */
    public int unsubscribe(String channel, ClientConnection conn) {
        synchronized (lock) {
            Set<ClientConnection> subs = channels.get(channel);
            if (subs != null && subs.remove(conn) && subs.isEmpty()) {
                channels.remove(channel);
            }
            return countSubscriptions(conn);
        }
    }

    /**
     * 向频道推送 ["message", channel, message]
     * 单个订阅者推送失败不影响发布者，也不计入返回值；已断开的订阅者在本轮推送结束后被移除，仍存活但写不进去的只是错过这条消息。
     *
     * @return 成功推送的订阅者数
     */
    public int publish(String channel, byte[] message) {
        // 1. 锁内拍快照
        List<ClientConnection> snapshot;
        synchronized (lock) {
            Set<ClientConnection> subs = channels.get(channel);
            if (subs == null) {
                return 0;
            }
            snapshot = new ArrayList<>(subs);
        }

        // 2. 锁外推送，消息只编码一次
        byte[] payload = RespCodecUtil.encode(new RedisArray(new RedisMessage[]{
                new BulkString(MESSAGE),
                new BulkString(channel),
                new BulkString(message)
        }));

        int delivered = 0;
        List<ClientConnection> failed = new ArrayList<>();
        for (ClientConnection sub : snapshot) {
            if (trySend(sub, payload)) {
                delivered++;
            } else if (!sub.isOpen()) {
                failed.add(sub);
            }
        }

        // 3. 回到锁内，只清理这次失败的订阅者
        if (!failed.isEmpty()) {
            synchronized (lock) {
                Set<ClientConnection> subs = channels.get(channel);
                if (subs != null) {
                    failed.forEach(subs::remove);
                    if (subs.isEmpty()) {
                        channels.remove(channel);
                    }
                }
            }
            log.debug("Pruned {} dead subscriber(s) from channel '{}'", failed.size(), channel);
        }
        return delivered;
    }

    /**
     * 连接断开时调用，从所有频道移除；从未订阅过的连接调用也是安全的
     */
    public void removeConnection(ClientConnection conn) {
        synchronized (lock) {
            Iterator<Map.Entry<String, Set<ClientConnection>>> it = channels.entrySet().iterator();
            while (it.hasNext()) {
                Set<ClientConnection> subs = it.next().getValue();
                if (subs.remove(conn) && subs.isEmpty()) {
                    it.remove();
                }
            }
        }
    }

    /**
     * 该连接当前订阅的频道列表 (按注册表遍历顺序)
     */
    public List<String> subscriptions(ClientConnection conn) {
        synchronized (lock) {
            List<String> result = new ArrayList<>();
            for (Map.Entry<String, Set<ClientConnection>> entry : channels.entrySet()) {
                if (entry.getValue().contains(conn)) {
                    result.add(entry.getKey());
                }
            }
            return result;
        }
    }

    public int channelCount() {
        synchronized (lock) {
            return channels.size();
        }
    }

    public int subscriberCount(String channel) {
        synchronized (lock) {
            Set<ClientConnection> subs = channels.get(channel);
            return subs == null ? 0 : subs.size();
        }
    }

    // 扫描整个注册表，调用方必须已持有锁
    private int countSubscriptions(ClientConnection conn) {
        int count = 0;
        for (Set<ClientConnection> subs : channels.values()) {
            if (subs.contains(conn)) {
                count++;
            }
        }
        return count;
    }

    private boolean trySend(ClientConnection sub, byte[] payload) {
        try {
            return sub.send(payload);
        } catch (RuntimeException e) {
            log.debug("Delivery to {} failed: {}", sub.id(), e.getMessage());
            return false;
        }
    }
}
