package cn.iinti.proxyfinder.proxy.diagnostics;

import cn.iinti.proxyfinder.utils.AsyncHttpInvoker;

import java.util.concurrent.CompletableFuture;

/**
 * 不经过任何代理的直连请求
 */
public interface DirectHttpGet {
    CompletableFuture<AsyncHttpInvoker.HttpResult> get(String url, int timeoutMillis);
}
