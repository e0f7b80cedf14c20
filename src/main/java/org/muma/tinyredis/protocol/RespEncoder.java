package org.muma.tinyredis.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import org.muma.tinyredis.utils.RespCodecUtil;

/**
 * RESP 协议编码器
 * 只处理 RedisMessage；已编码好的 ByteBuf (例如 Pub/Sub 推送) 会直接透传。
 */
public class RespEncoder extends MessageToByteEncoder<RedisMessage> {

    @Override
    protected void encode(ChannelHandlerContext ctx, RedisMessage msg, ByteBuf out) {
        RespCodecUtil.writeTo(out, msg);
    }
}
