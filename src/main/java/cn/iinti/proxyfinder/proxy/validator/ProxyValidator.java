package cn.iinti.proxyfinder.proxy.validator;

import cn.iinti.proxyfinder.proxy.filter.CountryHeuristic;
import cn.iinti.proxyfinder.resource.Anonymity;
import cn.iinti.proxyfinder.resource.CandidateProxy;
import cn.iinti.proxyfinder.resource.DropReason;
import cn.iinti.proxyfinder.resource.IpAndPort;
import cn.iinti.proxyfinder.resource.ValidatedProxy;
import cn.iinti.proxyfinder.resource.ValidationStatus;
import cn.iinti.proxyfinder.trace.Recorder;
import cn.iinti.proxyfinder.trace.impl.DiskRecorders;
import cn.iinti.proxyfinder.utils.AsyncHttpInvoker;
import cn.iinti.proxyfinder.utils.IpUtils;
import cn.iinti.proxyfinder.utils.ThreadPools;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * 两阶段探测：
 * <ol>
 *     <li>连通性检查，tcp连接失败直接丢弃</li>
 *     <li>功能探测，把候选当作http代理依次请求回显接口，第一个成功即停止，并记录这一次的耗时</li>
 * </ol>
 * 代理源没有给出匿名等级时，根据延迟粗略推断：快的当作高匿，中等当作普通匿名，慢的或者功能探测失败的当作透明。
 * 这是一个近似值，并没有真正检查代理转发时携带的请求头
 */
@Slf4j
public class ProxyValidator {
    public static final double ELITE_LATENCY_SECONDS = 2.0;
    public static final double ANONYMOUS_LATENCY_SECONDS = 5.0;

    private static final int HTTP_PROXY_AUTH_REQUIRED = 407;

    /**
     * future.get 在探测自身超时之外多等待的时间，异步客户端的超时回调会有少量延迟
     */
    private static final int TIMEOUT_GRACE_MILLIS = 500;

    private final ReachabilityProbe reachabilityProbe;
    private final FunctionalProbe functionalProbe;
    @Getter
    private final List<String> echoURLs;
    private final int connectTimeout;
    private final int probeTimeout;
    private final int concurrency;
    @Getter
    private final boolean lenient;
    private final boolean debug;
    private final Clock clock;

    @Builder
    public ProxyValidator(ReachabilityProbe reachabilityProbe, FunctionalProbe functionalProbe,
                          List<String> echoURLs, int connectTimeout, int probeTimeout, int concurrency,
                          boolean lenient, boolean debug, Clock clock) {
        Preconditions.checkArgument(echoURLs != null && !echoURLs.isEmpty(), "echoURLs can not be empty");
        this.reachabilityProbe = reachabilityProbe == null ? new NettyReachabilityProbe() : reachabilityProbe;
        this.functionalProbe = functionalProbe == null ? new HttpFunctionalProbe(Recorder.nop) : functionalProbe;
        this.echoURLs = ImmutableList.copyOf(echoURLs);
        this.connectTimeout = connectTimeout > 0 ? connectTimeout : 5_000;
        this.probeTimeout = probeTimeout > 0 ? probeTimeout : 10_000;
        this.concurrency = concurrency > 0 ? concurrency : 10;
        this.lenient = lenient;
        this.debug = debug;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public ValidationResult validate(CandidateProxy candidate) {
        return validate(candidate, lenient);
    }

    public ValidationResult validate(CandidateProxy candidate, boolean lenient) {
        String address = candidate.getAddress();
        IpAndPort ipAndPort = IpAndPort.parse(address);
        if (ipAndPort == null) {
            return ValidationResult.invalid(address, DropReason.MALFORMED);
        }
        Recorder recorder = DiskRecorders.IP_TEST.acquireRecorder(
                address + "_" + System.currentTimeMillis(), debug);
        recorder.recordEvent(() -> "[QualityTest] begin to test proxy: " + address + " from " + candidate.getSourceName());

        // phase A
        CompletableFuture<Void> connectFuture = reachabilityProbe.connect(ipAndPort, connectTimeout);
        try {
            connectFuture.get(connectTimeout + TIMEOUT_GRACE_MILLIS, TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException e) {
            connectFuture.cancel(true);
            recorder.recordEvent(() -> "[QualityTest] tcp connect failed", e);
            return ValidationResult.invalid(address, DropReason.UNREACHABLE);
        } catch (InterruptedException e) {
            connectFuture.cancel(true);
            Thread.currentThread().interrupt();
            return ValidationResult.invalid(address, DropReason.DEADLINE);
        }

        // phase B
        boolean functional = false;
        boolean requiresAuth = false;
        double latencySeconds = ValidatedProxy.UNMEASURED_LATENCY;
        String exitIp = null;
        for (String url : echoURLs) {
            long start = System.nanoTime();
            CompletableFuture<AsyncHttpInvoker.HttpResult> future = functionalProbe.get(ipAndPort, url, probeTimeout);
            AsyncHttpInvoker.HttpResult httpResult;
            try {
                httpResult = future.get(probeTimeout + TIMEOUT_GRACE_MILLIS, TimeUnit.MILLISECONDS);
            } catch (ExecutionException | TimeoutException e) {
                future.cancel(true);
                recorder.recordEvent(() -> "[QualityTest] echo failed: " + url, e);
                continue;
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                return ValidationResult.invalid(address, DropReason.DEADLINE);
            }
            double cost = roundLatency((System.nanoTime() - start) / 1_000_000_000.0);

            if (httpResult.getStatusCode() == HTTP_PROXY_AUTH_REQUIRED) {
                recorder.recordEvent(() -> "[QualityTest] proxy require authentication");
                requiresAuth = true;
                latencySeconds = cost;
                break;
            }
            if (httpResult.isSuccess()) {
                recorder.recordEvent(() -> "[QualityTest] echo success: " + url + " cost: " + cost + "s");
                functional = true;
                latencySeconds = cost;
                exitIp = IpUtils.extractExitIp(httpResult.getBody());
                break;
            }
            recorder.recordEvent(() -> "[QualityTest] echo status " + httpResult.getStatusCode() + ": " + url);
        }

        if (!functional && !lenient) {
            DropReason reason = requiresAuth ? DropReason.AUTH_REQUIRED : DropReason.NOT_FUNCTIONAL;
            recorder.recordEvent(() -> "[QualityTest] drop proxy: " + reason);
            return ValidationResult.invalid(address, reason);
        }

        Anonymity anonymity = candidate.getAnonymityHint();
        boolean inferred = anonymity == null || anonymity == Anonymity.UNKNOWN;
        if (inferred) {
            anonymity = inferAnonymity(functional, latencySeconds);
        }
        String country = candidate.isCountryKnown()
                ? candidate.getCountryHint().trim().toUpperCase()
                : CountryHeuristic.guess(address);

        ValidatedProxy validatedProxy = ValidatedProxy.builder()
                .address(address)
                .country(country)
                .anonymity(anonymity)
                .anonymityInferred(inferred)
                .latencySeconds(Math.max(0, latencySeconds))
                .requiresAuth(requiresAuth)
                .status(functional ? ValidationStatus.VALID : ValidationStatus.UNVALIDATED)
                .validatedAt(clock.millis())
                .exitIp(exitIp)
                .sourceName(candidate.getSourceName())
                .build();
        recorder.recordEvent(() -> "[QualityTest] test finished: " + validatedProxy);
        return ValidationResult.valid(validatedProxy);
    }

    /**
     * 并发探测一批候选，凑够wanted个符合accept条件的结果，或者截止时间到达即返回，剩余任务直接放弃
     */
    public List<ValidatedProxy> validateAll(List<CandidateProxy> candidates, boolean lenient, int wanted,
                                            long deadlineMillis, Predicate<ValidatedProxy> accept) {
        return validateAll(candidates, lenient, wanted, deadlineMillis, accept, null);
    }

    /**
     * @param observer 每一个探测成功的结果（包括被accept拒绝的）都会在调用线程上回调一次，可以为空
     */
    public List<ValidatedProxy> validateAll(List<CandidateProxy> candidates, boolean lenient, int wanted,
                                            long deadlineMillis, Predicate<ValidatedProxy> accept,
                                            @Nullable Consumer<ValidatedProxy> observer) {
        List<ValidatedProxy> ret = Lists.newArrayList();
        if (candidates == null || candidates.isEmpty() || wanted <= 0) {
            return ret;
        }
        long deadline = System.currentTimeMillis() + deadlineMillis;
        ExecutorService pool = ThreadPools.newScopedPool("proxy-validator", Math.min(concurrency, candidates.size()));
        CompletionService<ValidationResult> completionService = new ExecutorCompletionService<>(pool);
        // 结果只在当前线程汇总，worker通过completionService的队列交付
        Map<String, ValidatedProxy> collected = new LinkedHashMap<>();
        try {
            for (CandidateProxy candidate : candidates) {
                completionService.submit(() -> validate(candidate, lenient));
            }
            int pending = candidates.size();
            while (pending > 0 && collected.size() < wanted) {
                long remain = deadline - System.currentTimeMillis();
                if (remain <= 0) {
                    break;
                }
                Future<ValidationResult> done = completionService.poll(remain, TimeUnit.MILLISECONDS);
                if (done == null) {
                    break;
                }
                pending--;
                ValidationResult result;
                try {
                    result = done.get();
                } catch (ExecutionException e) {
                    log.warn("validate task failed unexpectedly", e.getCause());
                    continue;
                }
                ValidatedProxy proxy = result.getProxy();
                if (proxy == null) {
                    continue;
                }
                if (observer != null) {
                    observer.accept(proxy);
                }
                if (collected.containsKey(proxy.getAddress())) {
                    continue;
                }
                if (accept != null && !accept.test(proxy)) {
                    continue;
                }
                collected.put(proxy.getAddress(), proxy);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            pool.shutdownNow();
        }
        ret.addAll(collected.values());
        return ret;
    }

    static Anonymity inferAnonymity(boolean functional, double latencySeconds) {
        if (!functional) {
            return Anonymity.TRANSPARENT;
        }
        if (latencySeconds < ELITE_LATENCY_SECONDS) {
            return Anonymity.ELITE;
        }
        if (latencySeconds < ANONYMOUS_LATENCY_SECONDS) {
            return Anonymity.ANONYMOUS;
        }
        return Anonymity.TRANSPARENT;
    }

    private static double roundLatency(double seconds) {
        return Math.round(seconds * 1000) / 1000.0;
    }
}
