package cn.iinti.proxyfinder.proxy.validator;

import cn.iinti.proxyfinder.resource.IpAndPort;

import java.util.concurrent.CompletableFuture;

/**
 * 连通性检查：只确认tcp端口可以建立连接
 */
public interface ReachabilityProbe {
    CompletableFuture<Void> connect(IpAndPort address, int timeoutMillis);
}
