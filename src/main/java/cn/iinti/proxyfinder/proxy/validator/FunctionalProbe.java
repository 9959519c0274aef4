package cn.iinti.proxyfinder.proxy.validator;

import cn.iinti.proxyfinder.resource.IpAndPort;
import cn.iinti.proxyfinder.utils.AsyncHttpInvoker;

import java.util.concurrent.CompletableFuture;

/**
 * 功能探测：把候选当作http代理，请求一个回显接口
 */
public interface FunctionalProbe {
    CompletableFuture<AsyncHttpInvoker.HttpResult> get(IpAndPort proxy, String url, int timeoutMillis);
}
