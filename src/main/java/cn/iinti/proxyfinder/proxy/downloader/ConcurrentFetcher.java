package cn.iinti.proxyfinder.proxy.downloader;

import cn.iinti.proxyfinder.exception.SourceUnavailableException;
import cn.iinti.proxyfinder.resource.CandidateProxy;
import cn.iinti.proxyfinder.trace.Recorder;
import cn.iinti.proxyfinder.utils.ThreadPools;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nullable;
import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * 并发下载多个代理源。任何一个源失败或者超时都只记录日志，不影响其他源；
 * 整体截止时间到达时直接放弃仍在运行的任务，已经完成的结果保留
 */
public class ConcurrentFetcher {
    /**
     * 单次下载最多并发的源数量
     */
    public static final int MAX_PARALLEL_SOURCES = 5;

    /**
     * 主线程检查单源超时的最大间隔
     */
    private static final long POLL_TICK_MILLIS = 200;

    private final Recorder recorder;
    private final Clock clock;

    public ConcurrentFetcher(Recorder recorder, Clock clock) {
        this.recorder = recorder;
        this.clock = clock;
    }

    public List<CandidateProxy> fetch(List<SourceSpec> sources, int perSourceTimeout, long globalDeadlineMillis) {
        return fetch(sources, null, perSourceTimeout, globalDeadlineMillis);
    }

    /**
     * @param country              目标国家，可以为空
     * @param perSourceTimeout     单个源的超时，从任务真正开始执行时计时
     * @param globalDeadlineMillis 本次调用的整体耗时上限
     * @return 所有成功源的候选合集，顺序不做保证
     */
    public List<CandidateProxy> fetch(List<SourceSpec> sources, @Nullable String country,
                                      int perSourceTimeout, long globalDeadlineMillis) {
        if (sources == null || sources.isEmpty()) {
            return Collections.emptyList();
        }
        long deadline = System.currentTimeMillis() + globalDeadlineMillis;
        recorder.recordEvent(() -> "begin fetch from " + sources.size() + " sources, country: "
                + StringUtils.defaultIfBlank(country, "all"));

        ExecutorService pool = ThreadPools.newScopedPool("source-fetcher",
                Math.min(sources.size(), MAX_PARALLEL_SOURCES));
        CompletionService<List<CandidateProxy>> completionService = new ExecutorCompletionService<>(pool);
        Map<Future<List<CandidateProxy>>, SourceTask> tasks = Maps.newHashMap();
        List<CandidateProxy> ret = Lists.newArrayList();
        try {
            for (SourceSpec spec : sources) {
                SourceTask task = new SourceTask(spec, country, perSourceTimeout);
                tasks.put(completionService.submit(task), task);
            }

            int pending = tasks.size();
            while (pending > 0) {
                long now = System.currentTimeMillis();
                if (now >= deadline) {
                    int abandoned = pending;
                    recorder.recordEvent(() -> "global fetch deadline reached, abandon " + abandoned + " running sources");
                    break;
                }
                long wait = Math.min(deadline - now, POLL_TICK_MILLIS);
                for (Map.Entry<Future<List<CandidateProxy>>, SourceTask> entry : tasks.entrySet()) {
                    wait = Math.min(wait, entry.getValue().expireIfOverdue(entry.getKey(), now));
                }

                Future<List<CandidateProxy>> done = completionService.poll(Math.max(wait, 1), TimeUnit.MILLISECONDS);
                if (done == null) {
                    continue;
                }
                pending--;
                SourceTask task = tasks.get(done);
                if (done.isCancelled()) {
                    continue;
                }
                try {
                    List<CandidateProxy> candidates = done.get();
                    recorder.recordEvent(() -> "fetched " + candidates.size() + " candidates from " + task.spec.getName());
                    ret.addAll(candidates);
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof SourceUnavailableException) {
                        recorder.recordEvent(() -> "source unavailable: " + cause.getMessage());
                    } else {
                        recorder.recordEvent(() -> "unexpected error from source: " + task.spec.getName(), cause);
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recorder.recordEvent("fetch interrupted, return completed results only");
        } finally {
            pool.shutdownNow();
        }
        recorder.recordEvent(() -> "fetch finished, total candidates: " + ret.size());
        return ret;
    }

    private class SourceTask implements Callable<List<CandidateProxy>> {
        private final SourceSpec spec;
        private final String country;
        private final int timeout;
        private volatile long startedAt = 0;

        SourceTask(SourceSpec spec, String country, int timeout) {
            this.spec = spec;
            this.country = country;
            this.timeout = timeout;
        }

        @Override
        public List<CandidateProxy> call() {
            startedAt = System.currentTimeMillis();
            String queryCountry = spec.isCountrySupported() ? country : null;
            List<CandidateProxy> candidates = spec.getAdapter().fetch(spec, queryCountry, timeout);
            if (candidates == null) {
                return Collections.emptyList();
            }
            long fetchedAt = clock.millis();
            for (CandidateProxy candidate : candidates) {
                if (candidate.getSourceName() == null) {
                    candidate.setSourceName(spec.getName());
                }
                if (candidate.getFetchedAt() <= 0) {
                    candidate.setFetchedAt(fetchedAt);
                }
            }
            return candidates;
        }

        /**
         * 超时的任务直接中断
         *
         * @return 距离超时还剩多少毫秒，用于决定主线程的等待时间
         */
        long expireIfOverdue(Future<List<CandidateProxy>> future, long now) {
            long started = startedAt;
            if (started == 0 || future.isDone()) {
                return POLL_TICK_MILLIS;
            }
            long remain = started + timeout - now;
            if (remain > 0) {
                return remain;
            }
            recorder.recordEvent(() -> "source timeout after " + timeout + "ms: " + spec.getName());
            future.cancel(true);
            return POLL_TICK_MILLIS;
        }
    }
}
