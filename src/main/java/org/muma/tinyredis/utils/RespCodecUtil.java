package org.muma.tinyredis.utils;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import org.muma.tinyredis.protocol.BulkString;
import org.muma.tinyredis.protocol.ErrorMessage;
import org.muma.tinyredis.protocol.RedisArray;
import org.muma.tinyredis.protocol.RedisInteger;
import org.muma.tinyredis.protocol.RedisMessage;
import org.muma.tinyredis.protocol.SimpleString;

import java.nio.charset.StandardCharsets;

/**
 * RESP 协议编码工具类
 * 纯函数：RedisMessage -> 字节。RespEncoder 与 Pub/Sub 推送共用这一份逻辑。
 */
public final class RespCodecUtil {

    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.UTF_8);
    private static final byte[] NIL_LENGTH = "-1".getBytes(StandardCharsets.UTF_8);

    private RespCodecUtil() {
    }

    /**
     * 编码为独立的字节数组 (例如一次发布、多次推送)
     */
    public static byte[] encode(RedisMessage msg) {
        ByteBuf buf = Unpooled.buffer(64);
        try {
            writeTo(buf, msg);
            return ByteBufUtil.getBytes(buf);
        } finally {
            buf.release();
        }
    }

    /**
     * 递归写入。遇到未知类型直接抛异常，不做任何兜底转换。
     */
    public static void writeTo(ByteBuf out, RedisMessage msg) {
        if (msg instanceof SimpleString s) {
            writeLine(out, '+', s.content());
        } else if (msg instanceof ErrorMessage e) {
            writeLine(out, '-', e.content());
        } else if (msg instanceof RedisInteger i) {
            out.writeByte(':');
            writeAscii(out, i.value());
            out.writeBytes(CRLF);
        } else if (msg instanceof BulkString b) {
            out.writeByte('$');
            if (b.content() == null) {
                out.writeBytes(NIL_LENGTH);
                out.writeBytes(CRLF);
            } else {
                writeAscii(out, b.content().length);
                out.writeBytes(CRLF);
                out.writeBytes(b.content());
                out.writeBytes(CRLF);
            }
        } else if (msg instanceof RedisArray a) {
            out.writeByte('*');
            if (a.elements() == null) {
                out.writeBytes(NIL_LENGTH);
                out.writeBytes(CRLF);
            } else {
                writeAscii(out, a.elements().length);
                out.writeBytes(CRLF);
                for (RedisMessage element : a.elements()) {
                    writeTo(out, element);
                }
            }
        } else {
            throw new IllegalArgumentException("Cannot encode RESP value: " + msg);
        }
    }

    // 单行类型 (+/-) 内容里不能出现 CR/LF，否则会破坏帧边界
    private static void writeLine(ByteBuf out, char prefix, String content) {
        if (content == null) {
            throw new IllegalArgumentException("Line content must not be null for type '" + prefix + "'");
        }
        if (content.indexOf('\r') >= 0 || content.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("Line content must not contain CR or LF: " + content);
        }
        out.writeByte(prefix);
        out.writeBytes(content.getBytes(StandardCharsets.UTF_8));
        out.writeBytes(CRLF);
    }

    private static void writeAscii(ByteBuf out, long value) {
        out.writeCharSequence(Long.toString(value), StandardCharsets.US_ASCII);
    }
}
