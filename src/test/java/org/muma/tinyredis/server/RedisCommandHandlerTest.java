package org.muma.tinyredis.server;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.tinyredis.config.TinyRedisConfig;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 完整 pipeline (解码 -> 命令 -> 编码) 的协议级测试
 */
class RedisCommandHandlerTest {

    private AtomicLong now;
    private RedisServerContext server;

    @BeforeEach
    void setUp() {
        now = new AtomicLong(1_000_000L);
        server = new RedisServerContext(new TinyRedisConfig(), now::get);
    }

    private EmbeddedChannel connect() {
        return new EmbeddedChannel(new RedisChannelInitializer(server));
    }

    // 发送原始字节，返回这次产生的全部输出
    private String send(EmbeddedChannel channel, String raw) {
        channel.writeInbound(Unpooled.wrappedBuffer(raw.getBytes(StandardCharsets.UTF_8)));
        return drain(channel);
    }

    private String drain(EmbeddedChannel channel) {
        StringBuilder sb = new StringBuilder();
        ByteBuf buf;
        while ((buf = channel.readOutbound()) != null) {
            sb.append(buf.toString(StandardCharsets.UTF_8));
            buf.release();
        }
        return sb.toString();
    }

    private static String command(String... parts) {
        StringBuilder sb = new StringBuilder("*").append(parts.length).append("\r\n");
        for (String part : parts) {
            sb.append('$').append(part.getBytes(StandardCharsets.UTF_8).length).append("\r\n")
                    .append(part).append("\r\n");
        }
        return sb.toString();
    }

    @Test
    void testPing() {
        EmbeddedChannel client = connect();
        assertEquals("+PONG\r\n", send(client, "*1\r\n$4\r\nPING\r\n"));
        assertEquals("$5\r\nhello\r\n", send(client, command("ping", "hello")));
        assertEquals("-ERR wrong number of arguments for 'ping' command\r\n", send(client, command("PING", "a", "b")));
    }

    @Test
    void testEcho() {
        EmbeddedChannel client = connect();
        assertEquals("$3\r\nhey\r\n", send(client, "*2\r\n$4\r\nECHO\r\n$3\r\nhey\r\n"));
        assertEquals("-ERR wrong number of arguments for 'echo' command\r\n", send(client, command("ECHO")));
        assertTrue(client.isOpen(), "Command errors must not close the connection");
    }

    @Test
    void testSetGetWithTtl() {
        EmbeddedChannel client = connect();
        assertEquals("+OK\r\n", send(client, command("SET", "foo", "bar", "PX", "50")));
        assertEquals("$3\r\nbar\r\n", send(client, command("GET", "foo")));

        now.addAndGet(60);
        assertEquals("$-1\r\n", send(client, command("GET", "foo")));
    }

    @Test
    void testSetWithoutTtlNeverExpires() {
        EmbeddedChannel client = connect();
        send(client, command("SET", "foo", "v1", "px", "50"));
        assertEquals("+OK\r\n", send(client, command("set", "foo", "v2")));

        now.addAndGet(10_000);
        assertEquals("$2\r\nv2\r\n", send(client, command("GET", "foo")));
    }

    @Test
    void testSetRejectsNonIntegerTtlWithoutWriting() {
        EmbeddedChannel client = connect();
        assertEquals("-ERR value is not an integer or out of range\r\n",
                send(client, command("SET", "foo", "bar", "PX", "soon")));
        assertEquals("$-1\r\n", send(client, command("GET", "foo")));
    }

    /**
     * 测试场景：PX 0 等同于不带过期时间
     */
    @Test
    void testSetWithZeroTtlStoresWithoutExpiry() {
        EmbeddedChannel client = connect();
        assertEquals("+OK\r\n", send(client, command("SET", "foo", "bar", "PX", "0")));

        now.addAndGet(10_000);
        assertEquals("$3\r\nbar\r\n", send(client, command("GET", "foo")));
    }

    /**
     * 测试场景：负数 PX 照常写入，但截止时间已过，下一次 GET 就读不到
     */
    @Test
    void testSetWithNegativeTtlIsAlreadyExpired() {
        EmbeddedChannel client = connect();
        send(client, command("SET", "foo", "old"));
        assertEquals("+OK\r\n", send(client, command("SET", "foo", "bar", "PX", "-5")));
        assertEquals("$-1\r\n", send(client, command("GET", "foo")));
    }

    @Test
    void testSetWithHugeTtlDoesNotExpire() {
        EmbeddedChannel client = connect();
        assertEquals("+OK\r\n", send(client, command("SET", "foo", "bar", "PX", String.valueOf(Long.MAX_VALUE))));
        assertEquals("$3\r\nbar\r\n", send(client, command("GET", "foo")));

        now.addAndGet(1_000_000_000L);
        assertEquals("$3\r\nbar\r\n", send(client, command("GET", "foo")));
    }

    @Test
    void testSetArity() {
        EmbeddedChannel client = connect();
        assertEquals("-ERR wrong number of arguments for 'set' command\r\n", send(client, command("SET", "foo")));
        assertEquals("-ERR syntax error\r\n", send(client, command("SET", "foo", "bar", "PX")));
        assertEquals("-ERR syntax error\r\n", send(client, command("SET", "foo", "bar", "EX", "10")));
        assertEquals("$-1\r\n", send(client, command("GET", "foo")));
    }

    @Test
    void testGetArity() {
        EmbeddedChannel client = connect();
        String expected = "-ERR wrong number of arguments for 'get' command\r\n";
        assertEquals(expected, send(client, command("GET")));
        assertEquals(expected, send(client, command("GET", "a", "b")));
    }

    @Test
    void testUnknownCommand() {
        EmbeddedChannel client = connect();
        assertEquals("-ERR unknown command 'FOO'\r\n", send(client, command("FOO", "bar")));
        assertEquals("-ERR unknown command 'FOO'\r\n", send(client, "foo bar\r\n"));
    }

    @Test
    void testDel() {
        EmbeddedChannel client = connect();
        send(client, command("SET", "a", "1"));
        send(client, command("SET", "b", "2"));
        assertEquals(":2\r\n", send(client, command("DEL", "a", "b", "c")));
        assertEquals("$-1\r\n", send(client, command("GET", "a")));
        assertEquals("-ERR wrong number of arguments for 'del' command\r\n", send(client, command("DEL")));
    }

    @Test
    void testInlineCommands() {
        EmbeddedChannel client = connect();
        assertEquals("+PONG\r\n", send(client, "PING\r\n"));
        assertEquals("+OK\r\n", send(client, "SET greeting hello\n"));
        assertEquals("$5\r\nhello\r\n", send(client, "get greeting\r\n"));
    }

    @Test
    void testNonCommandValuesAreIgnored() {
        EmbeddedChannel client = connect();
        assertEquals("", send(client, "+hello\r\n:1\r\n*-1\r\n*0\r\n*1\r\n$-1\r\n\r\n"));
        assertEquals("+PONG\r\n", send(client, command("PING")));
        assertTrue(client.isOpen());
    }

    @Test
    void testNullArgumentIsACommandError() {
        EmbeddedChannel client = connect();
        assertEquals("-ERR Protocol error: null bulk string argument\r\n",
                send(client, "*2\r\n$3\r\nGET\r\n$-1\r\n"));
        assertTrue(client.isOpen());
    }

    @Test
    void testPipelinedRepliesKeepOrder() {
        EmbeddedChannel client = connect();
        String replies = send(client, command("SET", "k", "v") + command("GET", "k") + command("PING"));
        assertEquals("+OK\r\n$1\r\nv\r\n+PONG\r\n", replies);
    }

    /**
     * 测试场景：A 订阅，B 发布，A 收到推送，B 收到送达人数
     */
    @Test
    void testSubscribeAndPublish() {
        EmbeddedChannel a = connect();
        EmbeddedChannel b = connect();

        assertEquals("*3\r\n$9\r\nsubscribe\r\n$4\r\nchan\r\n:1\r\n", send(a, command("SUBSCRIBE", "chan")));
        assertEquals(":1\r\n", send(b, command("PUBLISH", "chan", "hello")));
        assertEquals("*3\r\n$7\r\nmessage\r\n$4\r\nchan\r\n$5\r\nhello\r\n", drain(a));
    }

    @Test
    void testSubscribeRepliesOncePerChannel() {
        EmbeddedChannel a = connect();

        String replies = send(a, command("SUBSCRIBE", "x", "y", "x"));
        assertEquals("*3\r\n$9\r\nsubscribe\r\n$1\r\nx\r\n:1\r\n"
                + "*3\r\n$9\r\nsubscribe\r\n$1\r\ny\r\n:2\r\n"
                + "*3\r\n$9\r\nsubscribe\r\n$1\r\nx\r\n:2\r\n", replies);
        assertEquals("-ERR wrong number of arguments for 'subscribe' command\r\n", send(a, command("SUBSCRIBE")));
    }

    @Test
    void testPublishArity() {
        EmbeddedChannel client = connect();
        assertEquals(":0\r\n", send(client, command("PUBLISH", "empty", "msg")));
        assertEquals("-ERR wrong number of arguments for 'publish' command\r\n", send(client, command("PUBLISH", "chan")));
    }

    @Test
    void testUnsubscribe() {
        EmbeddedChannel a = connect();
        send(a, command("SUBSCRIBE", "x", "y"));

        assertEquals("*3\r\n$11\r\nunsubscribe\r\n$1\r\nx\r\n:1\r\n", send(a, command("UNSUBSCRIBE", "x")));
        assertEquals("*3\r\n$11\r\nunsubscribe\r\n$1\r\ny\r\n:0\r\n", send(a, command("UNSUBSCRIBE")));
        assertEquals("*3\r\n$11\r\nunsubscribe\r\n$-1\r\n:0\r\n", send(a, command("UNSUBSCRIBE")));
        assertEquals(0, server.getPubSub().channelCount());
    }

    @Test
    void testDisconnectRemovesSubscriptions() {
        EmbeddedChannel a = connect();
        EmbeddedChannel b = connect();
        send(a, command("SUBSCRIBE", "chan"));

        a.close();

        assertEquals(0, server.getPubSub().channelCount());
        assertEquals(":0\r\n", send(b, command("PUBLISH", "chan", "hello")));
    }

    @Test
    void testProtocolErrorClosesConnectionAndUnsubscribes() {
        EmbeddedChannel a = connect();
        send(a, command("SUBSCRIBE", "chan"));

        assertEquals("", send(a, "$abc\r\n"));

        assertFalse(a.isOpen());
        assertEquals(0, server.getPubSub().channelCount());
    }

    @Test
    void testQuit() {
        EmbeddedChannel client = connect();
        assertEquals("+OK\r\n", send(client, command("QUIT")));
        assertFalse(client.isOpen());
    }
}
