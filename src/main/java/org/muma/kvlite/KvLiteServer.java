package org.muma.kvlite;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import org.muma.kvlite.command.CommandDispatcher;
import org.muma.kvlite.config.KvLiteConfig;
import org.muma.kvlite.protocol.RespDecoder;
import org.muma.kvlite.protocol.RespEncoder;
import org.muma.kvlite.server.RedisCommandHandler;
import org.muma.kvlite.server.RedisCoreExecutor;
import org.muma.kvlite.store.StorageEngine;
import org.muma.kvlite.store.impl.MemoryStorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class KvLiteServer {

    private static final Logger log = LoggerFactory.getLogger(KvLiteServer.class);

    private final KvLiteConfig config;

    // 进程级共享存储 (store.scope=SERVER 时使用)
    private final StorageEngine sharedStorage = new MemoryStorageEngine();
    private final CommandDispatcher dispatcher;
    private final RedisCoreExecutor coreExecutor = new RedisCoreExecutor();

    public KvLiteServer(KvLiteConfig config) {
        this.config = config;
        this.dispatcher = new CommandDispatcher(sharedStorage, config.getSlowLogMillis());
    }

    /**
     * 组装单个连接的 pipeline：解码 -> 编码 -> 命令处理
     */
    ChannelInitializer<SocketChannel> channelInitializer() {
        return new ChannelInitializer<>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                StorageEngine storage = config.getStoreScope() == KvLiteConfig.StoreScope.CONNECTION
                        ? new MemoryStorageEngine()
                        : sharedStorage;
                ch.pipeline()
                        .addLast(new RespDecoder())
                        .addLast(new RespEncoder())
                        .addLast(new RedisCommandHandler(dispatcher, storage, coreExecutor));
            }
        };
    }

    public void start() throws InterruptedException {
        EventLoopGroup bossGroup = new NioEventLoopGroup(1);
        EventLoopGroup workerGroup = new NioEventLoopGroup(config.getWorkerThreads());

        try {
            var bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .handler(new LoggingHandler(LogLevel.INFO))
                    // 禁用 Nagle 算法，降低延迟
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childOption(ChannelOption.SO_KEEPALIVE, true)
                    .childHandler(channelInitializer());

            log.info("Starting kv-lite server on {}:{} (store scope: {})",
                    config.getBindAddress(), config.getPort(), config.getStoreScope());
            Channel serverChannel = bootstrap.bind(config.getBindAddress(), config.getPort()).sync().channel();

            log.info("kv-lite started successfully.");
            serverChannel.closeFuture().sync();
        } finally {
            bossGroup.shutdownGracefully();
            workerGroup.shutdownGracefully();
            coreExecutor.shutdownGracefully();
        }
    }

    public static void main(String[] args) throws InterruptedException {
        KvLiteConfig config = KvLiteConfig.getInstance();
        config.load(args);
        new KvLiteServer(config).start();
    }
}
