package org.muma.kvlite.server;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import org.muma.kvlite.command.CommandDispatcher;
import org.muma.kvlite.protocol.BulkString;
import org.muma.kvlite.protocol.ErrorMessage;
import org.muma.kvlite.protocol.RedisArray;
import org.muma.kvlite.protocol.RedisMessage;
import org.muma.kvlite.protocol.RespProtocolException;
import org.muma.kvlite.protocol.SimpleString;
import org.muma.kvlite.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * 每个连接一个实例。解码后的命令交给 RedisCoreExecutor 单线程执行，回复写回客户端。
 */
public class RedisCommandHandler extends SimpleChannelInboundHandler<RedisMessage> {

    private static final Logger log = LoggerFactory.getLogger(RedisCommandHandler.class);

    private static final AtomicInteger connectedClients = new AtomicInteger();

    private final CommandDispatcher dispatcher;
    private final StorageEngine storage;
    private final RedisCoreExecutor coreExecutor;

    public RedisCommandHandler(CommandDispatcher dispatcher, StorageEngine storage, RedisCoreExecutor coreExecutor) {
        this.dispatcher = dispatcher;
        this.storage = storage;
        this.coreExecutor = coreExecutor;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        int total = connectedClients.incrementAndGet();
        log.info("Client connected: {}, total clients: {}", ctx.channel().remoteAddress(), total);
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        int total = connectedClients.decrementAndGet();
        log.info("Client disconnected: {}, total clients: {}", ctx.channel().remoteAddress(), total);
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RedisMessage msg) {
        if (log.isDebugEnabled()) {
            log.debug("Execute Command: {}", describe(msg));
        }

        // 所有命令提交到 CoreExecutor 单线程执行，QUIT 也排队，保证回复顺序
        coreExecutor.submit(() -> {
            if (isQuit(msg)) {
                ctx.writeAndFlush(SimpleString.OK).addListener(ChannelFutureListener.CLOSE);
                return;
            }
            RedisMessage response = dispatcher.execute(msg, storage);
            ctx.writeAndFlush(response);
        });
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        ErrorMessage reply;
        if (cause instanceof RespProtocolException e) {
            // 解码器已记录日志
            reply = new ErrorMessage("ERR " + e.getMessage());
        } else {
            log.error("Unexpected error on connection {}", ctx.channel().remoteAddress(), cause);
            reply = new ErrorMessage("ERR internal error");
        }

        // 同样走 CoreExecutor：先写完之前排队命令的回复，再回错误并关闭
        coreExecutor.submit(() -> ctx.writeAndFlush(reply).addListener(ChannelFutureListener.CLOSE));
    }

    private boolean isQuit(RedisMessage msg) {
        return msg instanceof RedisArray array
                && array.size() == 1
                && array.elements()[0] instanceof BulkString name
                && "QUIT".equals(name.asString().toUpperCase(Locale.ROOT));
    }

    private String describe(RedisMessage msg) {
        if (msg instanceof RedisArray array) {
            return Arrays.stream(array.elements())
                    .map(e -> e instanceof BulkString b ? b.asString() : String.valueOf(e))
                    .collect(Collectors.joining(" "));
        }
        return String.valueOf(msg);
    }
}
