package cn.iinti.proxyfinder.proxy.validator;

import cn.iinti.proxyfinder.resource.IpAndPort;
import cn.iinti.proxyfinder.trace.Recorder;
import cn.iinti.proxyfinder.utils.AsyncHttpInvoker;
import org.asynchttpclient.proxy.ProxyServer;
import org.asynchttpclient.proxy.ProxyType;

import java.util.concurrent.CompletableFuture;

public class HttpFunctionalProbe implements FunctionalProbe {
    private final Recorder recorder;

    public HttpFunctionalProbe(Recorder recorder) {
        this.recorder = recorder;
    }

    @Override
    public CompletableFuture<AsyncHttpInvoker.HttpResult> get(IpAndPort proxy, String url, int timeoutMillis) {
        ProxyServer.Builder proxyBuilder = new ProxyServer.Builder(proxy.getIp(), proxy.getPort())
                .setProxyType(ProxyType.HTTP);
        return AsyncHttpInvoker.get(url, recorder, proxyBuilder, timeoutMillis);
    }
}
