package cn.iinti.proxyfinder.utils;

import cn.iinti.proxyfinder.trace.Recorder;
import lombok.Getter;
import org.asynchttpclient.AsyncHttpClient;
import org.asynchttpclient.BoundRequestBuilder;
import org.asynchttpclient.DefaultAsyncHttpClientConfig;
import org.asynchttpclient.proxy.ProxyServer;

import javax.annotation.Nullable;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;

import static org.asynchttpclient.Dsl.asyncHttpClient;

/**
 * 请注意，为了避免日志刷屏，本模块强制要求使用recorder记录日志
 * 另外由于他是异步的，也要求使用recorder
 */
public class AsyncHttpInvoker {
    private static final String USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0 Safari/537.36";

    public static final AsyncHttpClient httpclient = asyncHttpClient(
            new DefaultAsyncHttpClientConfig.Builder()
                    // 每次探测的代理都不同，复用连接没有意义
                    .setKeepAlive(false)
                    .setConnectTimeout(10000)
                    .setReadTimeout(8000)
                    .setFollowRedirect(true)
                    .setUseInsecureTrustManager(true)
                    .setUserAgent(USER_AGENT)
                    .setEventLoopGroup(ThreadPools.asyncHttpWorkGroup)
                    .build());

    @Getter
    public static class HttpResult {
        private final int statusCode;
        private final String body;

        public HttpResult(int statusCode, String body) {
            this.statusCode = statusCode;
            this.body = body;
        }

        public boolean isSuccess() {
            return statusCode >= 200 && statusCode < 300;
        }
    }

    public static CompletableFuture<HttpResult> get(String url, Recorder recorder, int timeoutMillis) {
        return get(url, recorder, null, timeoutMillis);
    }

    public static CompletableFuture<HttpResult> get(String url, Recorder recorder,
                                                    @Nullable ProxyServer.Builder proxyBuilder,
                                                    int timeoutMillis) {
        recorder.recordEvent(() -> "begin async invoker: " + url);
        BoundRequestBuilder getRequest = httpclient.prepareGet(url)
                .setRequestTimeout(timeoutMillis)
                .setReadTimeout(timeoutMillis);
        if (proxyBuilder != null) {
            getRequest.setProxyServer(proxyBuilder);
        }

        return execute(getRequest, recorder);
    }

    private static CompletableFuture<HttpResult> execute(BoundRequestBuilder requestBuilder, Recorder recorder) {
        return requestBuilder.execute().toCompletableFuture()
                .thenApply(response -> {
                    String responseBody = response.getResponseBody(StandardCharsets.UTF_8).trim();
                    recorder.recordEvent(() -> "async response status:" + response.getStatusCode());
                    return new HttpResult(response.getStatusCode(), responseBody);
                });
    }
}
