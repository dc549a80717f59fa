package org.muma.kvlite.server;

import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;

/**
 * 核心业务线程 (Single Thread Logic)
 * 所有的 CommandDispatcher.execute 都在这里排队执行，存储层因此无需加锁。
 */
public class RedisCoreExecutor {

    private final EventExecutor singleThread;

    public RedisCoreExecutor() {
        // Netty 的 DefaultEventExecutor 是一个单线程事件循环
        this(new DefaultEventExecutor());
    }

    public RedisCoreExecutor(EventExecutor executor) {
        this.singleThread = executor;
    }

    public void submit(Runnable task) {
        singleThread.execute(task);
    }

    public Future<?> shutdownGracefully() {
        return singleThread.shutdownGracefully();
    }
}
