package cn.iinti.proxyfinder.proxy.validator;

import cn.iinti.proxyfinder.resource.IpAndPort;
import cn.iinti.proxyfinder.utils.ThreadPools;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelOption;
import io.netty.channel.socket.nio.NioSocketChannel;

import java.util.concurrent.CompletableFuture;

public class NettyReachabilityProbe implements ReachabilityProbe {
    private static final Bootstrap probeBootstrap = buildProbeBootstrap();

    private static Bootstrap buildProbeBootstrap() {
        return new Bootstrap()
                .group(ThreadPools.probeGroup)
                .channelFactory(NioSocketChannel::new)
                // 只做连接测试，不会读写任何数据
                .handler(new StubHandler());
    }

    @ChannelHandler.Sharable
    public static class StubHandler extends ChannelInboundHandlerAdapter {
        @Override
        public void channelRegistered(ChannelHandlerContext ctx) {
            // just make netty framework happy
            ctx.pipeline().remove(this);
        }
    }

    @Override
    public CompletableFuture<Void> connect(IpAndPort address, int timeoutMillis) {
        CompletableFuture<Void> ret = new CompletableFuture<>();
        probeBootstrap.clone()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutMillis)
                .connect(address.getIp(), address.getPort())
                .addListener((ChannelFutureListener) future -> {
                    if (!future.isSuccess()) {
                        ret.completeExceptionally(future.cause());
                        return;
                    }
                    future.channel().close();
                    ret.complete(null);
                });
        return ret;
    }
}
