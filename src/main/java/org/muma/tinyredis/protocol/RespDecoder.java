package org.muma.tinyredis.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.ReplayingDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * RESP 协议解码器
 * 状态机逻辑由 ReplayingDecoder 自动处理：数据不够时回滚到帧起点，等下一批字节到达再重来。
 * 一旦读到类型前缀就按该类型解析到底，不做回退。
 */
public class RespDecoder extends ReplayingDecoder<Void> {

    private static final Logger log = LoggerFactory.getLogger(RespDecoder.class);

    // RESP 协议常量
    private static final byte PLUS_BYTE = '+';
    private static final byte MINUS_BYTE = '-';
    private static final byte COLON_BYTE = ':';
    private static final byte DOLLAR_BYTE = '$';
    private static final byte ASTERISK_BYTE = '*';

    // 回车换行
    private static final byte CR = '\r';
    private static final byte LF = '\n';

    public static final long DEFAULT_MAX_BULK_LENGTH = 512L * 1024 * 1024;
    // 单个 bulk 读入一个 byte[]，上限受数组长度约束
    public static final long MAX_BULK_LENGTH_LIMIT = Integer.MAX_VALUE - 8;
    public static final int DEFAULT_MAX_ARRAY_LENGTH = 1024 * 1024;

    private final long maxBulkLength;
    private final int maxArrayLength;

    public RespDecoder() {
        this(DEFAULT_MAX_BULK_LENGTH, DEFAULT_MAX_ARRAY_LENGTH);
    }

    public RespDecoder(long maxBulkLength, int maxArrayLength) {
        this.maxBulkLength = Math.min(maxBulkLength, MAX_BULK_LENGTH_LIMIT);
        this.maxArrayLength = maxArrayLength;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        out.add(readNextObject(in));
    }

    /**
     * 连接关闭时缓冲区里还有半个帧：记录下来并丢弃，连接随后被拆除
     */
    @Override
    protected void decodeLast(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        int remaining = actualReadableBytes();
        if (remaining > 0) {
            log.warn("Stream closed mid-frame from {}, {} byte(s) discarded", ctx.channel().remoteAddress(), remaining);
        }
    }

    // 读取一个完整的 RedisMessage，数组元素递归调用
    private RedisMessage readNextObject(ByteBuf in) {
        byte type = in.readByte();
        return switch (type) {
            case PLUS_BYTE -> new SimpleString(readLine(in));
            case MINUS_BYTE -> new ErrorMessage(readLine(in));
            case COLON_BYTE -> new RedisInteger(readLong(in, "integer"));
            case DOLLAR_BYTE -> decodeBulkString(in);
            case ASTERISK_BYTE -> decodeArray(in);
            default -> decodeInline(in, type);
        };
    }

    // 解析 BulkString: $<length>\r\n<data>\r\n
    private BulkString decodeBulkString(ByteBuf in) {
        long length = readLong(in, "bulk length");
        if (length == -1) {
            return BulkString.NULL;
        }
        if (length < 0 || length > maxBulkLength) {
            throw new CorruptedFrameException("Protocol error: invalid bulk length " + length);
        }

        byte[] content = new byte[(int) length];
        in.readBytes(content);

        // 严格读取 2 个字节作为结尾；不是 CRLF 也保留已读到的内容
        byte b1 = in.readByte();
        byte b2 = in.readByte();
        if (b1 != CR || b2 != LF) {
            log.warn("Expected CRLF after bulk string of {} bytes, got 0x{}{}",
                    length, String.format("%02x", b1), String.format("%02x", b2));
        }
        return new BulkString(content);
    }

    // 解析 Array: *<count>\r\n<element1>...<elementN>
    private RedisArray decodeArray(ByteBuf in) {
        long count = readLong(in, "multibulk length");
        if (count == -1) {
            return RedisArray.NULL;
        }
        if (count < 0 || count > maxArrayLength) {
            throw new CorruptedFrameException("Protocol error: invalid multibulk length " + count);
        }

        RedisMessage[] elements = new RedisMessage[(int) count];
        for (int i = 0; i < count; i++) {
            elements[i] = readNextObject(in);
        }
        return new RedisArray(elements);
    }

    /**
     * 内联命令: 没有类型前缀的纯文本行，例如 telnet 里直接敲 "SET foo bar"
     * 按空白切分，返回 SimpleString 数组
     */
    private RedisArray decodeInline(ByteBuf in, byte first) {
        byte[] line;
        if (first == LF) {
            line = new byte[0];
        } else {
            byte[] rest = readLineBytes(in);
            line = new byte[rest.length + 1];
            line[0] = first;
            System.arraycopy(rest, 0, line, 1, rest.length);
        }

        List<RedisMessage> tokens = new ArrayList<>();
        for (String token : new String(line, StandardCharsets.UTF_8).trim().split("\\s+")) {
            if (!token.isEmpty()) {
                tokens.add(new SimpleString(token));
            }
        }
        return new RedisArray(tokens.toArray(new RedisMessage[0]));
    }

    // 读取一行（读到 LF 为止），去掉行尾的 CR；兼容只有 LF 的客户端
    private String readLine(ByteBuf in) {
        return new String(readLineBytes(in), StandardCharsets.UTF_8);
    }

    private byte[] readLineBytes(ByteBuf in) {
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        while (true) {
            byte b = in.readByte();
            if (b == LF) {
                break;
            }
            line.write(b);
        }
        byte[] bytes = line.toByteArray();
        int len = bytes.length;
        if (len > 0 && bytes[len - 1] == CR) {
            return Arrays.copyOf(bytes, len - 1);
        }
        return bytes;
    }

    private long readLong(ByteBuf in, String what) {
        String s = readLine(in);
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new CorruptedFrameException("Protocol error: invalid " + what + " '" + s + "'", e);
        }
    }
}
