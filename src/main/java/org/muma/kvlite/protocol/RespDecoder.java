package org.muma.kvlite.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * RESP 协议解码器
 * <p>
 * 每次 decode 从 readerIndex 开始尝试解析一条完整命令：
 * 1. 数据不够 (INCOMPLETE_INPUT)：回滚 readerIndex，等待下一批字节
 * 2. 协议错误：丢弃缓冲区剩余数据，把异常交给后面的 handler
 * <p>
 * 【注意】这里不能直接回写 -ERR：同一批字节里先解析出的命令可能还在 CoreExecutor 排队，
 * 错误回复必须排在它们之后，由 RedisCommandHandler 负责回复并关闭连接
 */
public class RespDecoder extends ByteToMessageDecoder {

    private static final Logger log = LoggerFactory.getLogger(RespDecoder.class);

    private boolean failed;

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (failed) {
            in.skipBytes(in.readableBytes());
            return;
        }

        int start = in.readerIndex();
        try {
            out.add(RespCodec.parse(in));
        } catch (RespProtocolException e) {
            if (e.getKind() == ProtocolErrorKind.INCOMPLETE_INPUT) {
                in.readerIndex(start);
                return;
            }

            failed = true;
            in.skipBytes(in.readableBytes());
            log.warn("Protocol error from {}: {} ({})", ctx.channel().remoteAddress(), e.getMessage(), e.getKind());
            ctx.fireExceptionCaught(e);
        }
    }
}
