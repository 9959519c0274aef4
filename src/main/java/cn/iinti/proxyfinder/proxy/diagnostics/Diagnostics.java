package cn.iinti.proxyfinder.proxy.diagnostics;

import cn.iinti.proxyfinder.trace.Recorder;
import cn.iinti.proxyfinder.utils.AsyncHttpInvoker;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 环境诊断：不经过代理直接请求连通性地址和回显接口。
 * 回显接口本身不可用时，所有候选的功能探测都会失败，找不到代理时先用它排查本机网络
 */
@Slf4j
public class Diagnostics {
    private static final int TIMEOUT_GRACE_MILLIS = 500;

    private final DirectHttpGet httpGet;
    private final List<String> connectivityURLs;
    private final List<String> echoURLs;
    private final int timeoutMillis;
    private final Recorder recorder;
    private final Clock clock;

    @Builder
    public Diagnostics(DirectHttpGet httpGet, List<String> connectivityURLs, List<String> echoURLs,
                       int timeoutMillis, Recorder recorder, Clock clock) {
        Preconditions.checkArgument(echoURLs != null && !echoURLs.isEmpty(), "echoURLs can not be empty");
        this.recorder = recorder == null ? Recorder.nop : recorder;
        this.httpGet = httpGet == null
                ? (url, timeout) -> AsyncHttpInvoker.get(url, this.recorder, timeout)
                : httpGet;
        this.connectivityURLs = connectivityURLs == null ? ImmutableList.of() : ImmutableList.copyOf(connectivityURLs);
        this.echoURLs = ImmutableList.copyOf(echoURLs);
        this.timeoutMillis = timeoutMillis > 0 ? timeoutMillis : 5_000;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public DiagnosticsReport run() {
        log.info("running diagnostics...");
        DiagnosticsReport report = new DiagnosticsReport(clock.millis(),
                checkAll(connectivityURLs), checkAll(echoURLs));
        log.info("diagnostics complete - {}", report.summary());
        if (report.getWorkingCount() == 0) {
            log.warn("no echo endpoint reachable directly, functional checks through proxies will fail");
        }
        return report;
    }

    public List<EndpointStatus> checkEchoEndpoints() {
        return checkAll(echoURLs);
    }

    /**
     * 所有请求同时发出，再依次等待结果
     */
    List<EndpointStatus> checkAll(List<String> urls) {
        Map<String, CompletableFuture<EndpointStatus>> pending = new LinkedHashMap<>();
        for (String url : urls) {
            pending.putIfAbsent(url, check(url));
        }
        List<EndpointStatus> ret = Lists.newArrayList();
        for (Map.Entry<String, CompletableFuture<EndpointStatus>> entry : pending.entrySet()) {
            String url = entry.getKey();
            CompletableFuture<EndpointStatus> future = entry.getValue();
            EndpointStatus status;
            try {
                status = future.get(timeoutMillis + TIMEOUT_GRACE_MILLIS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                status = EndpointStatus.failed(url, "timeout after " + timeoutMillis + "ms");
            } catch (ExecutionException e) {
                status = EndpointStatus.failed(url, ExceptionUtils.getRootCauseMessage(e));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                status = EndpointStatus.failed(url, "interrupted");
            }
            EndpointStatus finalStatus = status;
            recorder.recordEvent(() -> "[Diagnostics] " + finalStatus);
            ret.add(status);
        }
        return ret;
    }

    private CompletableFuture<EndpointStatus> check(String url) {
        long start = System.nanoTime();
        CompletableFuture<AsyncHttpInvoker.HttpResult> future;
        try {
            future = httpGet.get(url, timeoutMillis);
        } catch (RuntimeException e) {
            // 非法url在发起请求时直接抛出
            return CompletableFuture.completedFuture(EndpointStatus.failed(url, ExceptionUtils.getRootCauseMessage(e)));
        }
        return future.handle((httpResult, throwable) -> {
            if (throwable != null) {
                return EndpointStatus.failed(url, ExceptionUtils.getRootCauseMessage(throwable));
            }
            double seconds = Math.round((System.nanoTime() - start) / 1_000_000.0) / 1000.0;
            return EndpointStatus.responded(url, httpResult.getStatusCode(), seconds);
        });
    }
}
