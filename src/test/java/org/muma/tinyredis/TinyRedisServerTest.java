package org.muma.tinyredis;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.tinyredis.config.TinyRedisConfig;
import org.muma.tinyredis.server.RedisServerContext;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 端到端：真实 TCP 连接
 */
class TinyRedisServerTest {

    private TinyRedisServer server;
    private int port;

    @BeforeEach
    void setUp() throws InterruptedException {
        TinyRedisConfig config = new TinyRedisConfig();
        config.setHost("127.0.0.1");
        config.setPort(0); // 系统分配端口
        config.setWorkerThreads(2);

        server = new TinyRedisServer(new RedisServerContext(config));
        server.start();
        port = server.getBoundPort();
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private Socket connect() throws IOException {
        Socket socket = new Socket("127.0.0.1", port);
        socket.setSoTimeout(5_000);
        return socket;
    }

    private void write(Socket socket, String raw) throws IOException {
        OutputStream out = socket.getOutputStream();
        out.write(raw.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    private String readExactly(Socket socket, String expected) throws IOException {
        byte[] buf = new byte[expected.getBytes(StandardCharsets.UTF_8).length];
        InputStream in = socket.getInputStream();
        int read = 0;
        while (read < buf.length) {
            int n = in.read(buf, read, buf.length - read);
            if (n < 0) break;
            read += n;
        }
        return new String(buf, 0, read, StandardCharsets.UTF_8);
    }

    private void assertReply(Socket socket, String expected) throws IOException {
        assertEquals(expected, readExactly(socket, expected));
    }

    @Test
    void testBasicCommandsOverTcp() throws IOException {
        try (Socket client = connect()) {
            write(client, "*1\r\n$4\r\nPING\r\n");
            assertReply(client, "+PONG\r\n");

            write(client, "*3\r\n$3\r\nSET\r\n$3\r\nfoo\r\n$3\r\nbar\r\n");
            assertReply(client, "+OK\r\n");

            // 拆成两段发送
            write(client, "*2\r\n$3\r\nGE");
            write(client, "T\r\n$3\r\nfoo\r\n");
            assertReply(client, "$3\r\nbar\r\n");

            write(client, "FOO bar\r\n");
            assertReply(client, "-ERR unknown command 'FOO'\r\n");
        }
    }

    @Test
    void testExpiryOverTcp() throws IOException, InterruptedException {
        try (Socket client = connect()) {
            write(client, "*5\r\n$3\r\nSET\r\n$3\r\nfoo\r\n$3\r\nbar\r\n$2\r\nPX\r\n$2\r\n50\r\n");
            assertReply(client, "+OK\r\n");
            write(client, "*2\r\n$3\r\nGET\r\n$3\r\nfoo\r\n");
            assertReply(client, "$3\r\nbar\r\n");

            Thread.sleep(60);
            write(client, "*2\r\n$3\r\nGET\r\n$3\r\nfoo\r\n");
            assertReply(client, "$-1\r\n");
        }
    }

    @Test
    void testPubSubOverTcp() throws IOException {
        try (Socket subscriber = connect(); Socket publisher = connect()) {
            write(subscriber, "*2\r\n$9\r\nSUBSCRIBE\r\n$4\r\nchan\r\n");
            assertReply(subscriber, "*3\r\n$9\r\nsubscribe\r\n$4\r\nchan\r\n:1\r\n");

            write(publisher, "*3\r\n$7\r\nPUBLISH\r\n$4\r\nchan\r\n$5\r\nhello\r\n");
            assertReply(publisher, ":1\r\n");
            assertReply(subscriber, "*3\r\n$7\r\nmessage\r\n$4\r\nchan\r\n$5\r\nhello\r\n");
        }
    }

    @Test
    void testMalformedFrameClosesOnlyThatConnection() throws IOException {
        try (Socket bad = connect(); Socket good = connect()) {
            write(bad, "*1\r\n$x\r\n");
            assertEquals(-1, bad.getInputStream().read(), "Server should close the connection");

            write(good, "*1\r\n$4\r\nPING\r\n");
            assertReply(good, "+PONG\r\n");
        }
    }
}
