package cn.iinti.proxyfinder.utils;

import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.util.concurrent.DefaultThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

public class ThreadPools {

    /**
     * 连通性探测使用的netty线程池
     */
    public static final NioEventLoopGroup probeGroup = newDefaultEventLoop("reachability-probe");

    // 下载代理源、通过代理请求回显接口
    public static final NioEventLoopGroup asyncHttpWorkGroup =
            new NioEventLoopGroup(2, createThreadFactory("async-http-invoker"));


    private static NioEventLoopGroup newDefaultEventLoop(String name) {
        return new NioEventLoopGroup(0, createThreadFactory(name));
    }

    private static DefaultThreadFactory createThreadFactory(String name) {
        return new DefaultThreadFactory(name + "-" + DefaultThreadFactory.toPoolName(NioEventLoopGroup.class), true);
    }

    /**
     * 单次调用内使用的有界线程池，调用方负责在调用结束时 shutdownNow
     */
    public static ExecutorService newScopedPool(String name, int size) {
        int poolSize = Math.max(1, size);
        return new ThreadPoolExecutor(poolSize, poolSize, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), new DefaultThreadFactory(name, true));
    }
}
