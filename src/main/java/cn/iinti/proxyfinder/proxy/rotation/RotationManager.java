package cn.iinti.proxyfinder.proxy.rotation;

import cn.iinti.proxyfinder.proxy.downloader.ConcurrentFetcher;
import cn.iinti.proxyfinder.proxy.downloader.SourceCatalog;
import cn.iinti.proxyfinder.proxy.downloader.SourceSpec;
import cn.iinti.proxyfinder.proxy.filter.CandidateFilter;
import cn.iinti.proxyfinder.proxy.validator.ProxyValidator;
import cn.iinti.proxyfinder.resource.Anonymity;
import cn.iinti.proxyfinder.resource.CandidateProxy;
import cn.iinti.proxyfinder.resource.DropReason;
import cn.iinti.proxyfinder.resource.ValidatedProxy;
import cn.iinti.proxyfinder.trace.Recorder;
import cn.iinti.proxyfinder.trace.impl.DiskRecorders;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import lombok.Builder;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 轮换调度：循环执行 抓取 → 过滤 → 探测，直到凑够需要的代理或者重试预算耗尽。
 * 每次请求拥有独立的状态和会话缓存，manager本身不保存请求之间的状态，可以被多个线程同时使用
 */
public class RotationManager {
    private static final AtomicLong sessionSeq = new AtomicLong(0);

    private final SourceCatalog catalog;
    private final ConcurrentFetcher fetcher;
    private final CandidateFilter filter;
    private final ProxyValidator validator;
    private final RetryBudget retryBudget;
    private final int maxRetries;
    private final int sourceTimeout;
    private final long fetchDeadline;
    private final long validateDeadline;
    private final int maxCandidates;
    private final Random random;
    private final boolean debug;

    @Builder
    public RotationManager(SourceCatalog catalog, ConcurrentFetcher fetcher, CandidateFilter filter,
                           ProxyValidator validator, RetryBudget retryBudget, int maxRetries,
                           int sourceTimeout, long fetchDeadline, long validateDeadline,
                           int maxCandidates, Random random, boolean debug) {
        this.catalog = Preconditions.checkNotNull(catalog, "catalog");
        this.fetcher = Preconditions.checkNotNull(fetcher, "fetcher");
        this.filter = Preconditions.checkNotNull(filter, "filter");
        this.validator = Preconditions.checkNotNull(validator, "validator");
        this.retryBudget = retryBudget == null ? RetryBudget.DEFAULT : retryBudget;
        this.maxRetries = maxRetries > 0 ? maxRetries : 3;
        this.sourceTimeout = sourceTimeout > 0 ? sourceTimeout : 10_000;
        this.fetchDeadline = fetchDeadline > 0 ? fetchDeadline : 30_000;
        this.validateDeadline = validateDeadline > 0 ? validateDeadline : 60_000;
        this.maxCandidates = maxCandidates;
        this.random = random == null ? new Random() : random;
        this.debug = debug;
    }

    /**
     * 获取一个可用代理，最多执行 maxRetries 轮。
     * 多个国家时每一轮按国家依次抓取，找到第一个即返回
     *
     * @param countries 已经规范化的国家代码，可以为空
     * @param anonymity 要求的匿名等级，为空表示不限制
     */
    public RotationResult getOne(List<String> countries, @Nullable Anonymity anonymity) {
        Request request = new Request("getOne");
        SessionCache session = new SessionCache();
        List<String> countryList = countries == null ? Collections.emptyList() : countries;

        int rounds = 0;
        while (rounds < maxRetries) {
            rounds++;
            int round = rounds;
            request.recorder.recordEvent(() -> "getOne round " + round + "/" + maxRetries);

            if (countryList.size() > 1) {
                for (String country : countryList) {
                    ValidatedProxy proxy = tryOne(request, session, country,
                            Collections.singletonList(country), anonymity);
                    if (proxy != null) {
                        return request.finish(Collections.singletonList(proxy), RotationState.SATISFIED, rounds);
                    }
                }
            } else {
                String country = countryList.isEmpty() ? null : countryList.get(0);
                ValidatedProxy proxy = tryOne(request, session, country, countryList, anonymity);
                if (proxy != null) {
                    return request.finish(Collections.singletonList(proxy), RotationState.SATISFIED, rounds);
                }
            }
        }
        return request.finish(Collections.emptyList(), RotationState.EXHAUSTED, rounds);
    }

    @Nullable
    private ValidatedProxy tryOne(Request request, SessionCache session, @Nullable String country,
                                  List<String> allowlist, @Nullable Anonymity anonymity) {
        request.transition(RotationState.FETCHING);
        List<CandidateProxy> candidates = fetchAndFilter(catalog.select(country), country, allowlist);

        List<CandidateProxy> toValidate = Lists.newArrayList();
        int mismatched = 0;
        for (CandidateProxy candidate : candidates) {
            // 探测成功但是匿名等级不符合的不再重复探测，探测失败的每一轮都可以重试
            if (session.lookup(candidate.getAddress()) != null) {
                continue;
            }
            if (hintMismatch(candidate, anonymity)) {
                mismatched++;
                continue;
            }
            toValidate.add(candidate);
        }
        request.recordMismatch(mismatched);
        if (toValidate.isEmpty()) {
            request.recorder.recordEvent(() -> "nothing to validate for country: " + country);
            return null;
        }

        request.transition(RotationState.VALIDATING);
        List<ValidatedProxy> validated = validator.validateAll(toValidate, validator.isLenient(), 1,
                validateDeadline, anonymityFilter(anonymity), session::recordValidated);
        return validated.isEmpty() ? null : validated.get(0);
    }

    public RotationResult getMany(int n, List<String> countries, @Nullable Anonymity anonymity) {
        return getMany(n, countries, anonymity, retryBudget, Collections.emptySet());
    }

    public RotationResult getMany(int n, List<String> countries, @Nullable Anonymity anonymity,
                                  RetryBudget budgetConfig) {
        return getMany(n, countries, anonymity, budgetConfig, Collections.emptySet());
    }

    /**
     * @param exclude 调用方已经持有的地址，本次请求不会再返回
     */
    public RotationResult getMany(int n, List<String> countries, @Nullable Anonymity anonymity,
                                  Collection<String> exclude) {
        return getMany(n, countries, anonymity, retryBudget, exclude);
    }

    /**
     * 批量获取n个代理。
     * <ul>
     *     <li>普通轮次只探测本次会话没有见过的候选，一轮没有任何新候选时直接快进到冲刺阶段</li>
     *     <li>冲刺阶段除了新候选，还会从见过但是没有收集到的候选中随机抽样重试；冲刺阶段无可重试时结束</li>
     *     <li>探测成功的结果记录在会话缓存中，被匿名条件拒绝的地址不会再次探测</li>
     * </ul>
     * 结果按延迟升序，最多n个；一个都没有时状态为EXHAUSTED，部分满足时原样返回
     */
    public RotationResult getMany(int n, List<String> countries, @Nullable Anonymity anonymity,
                                  RetryBudget budgetConfig, Collection<String> exclude) {
        Preconditions.checkArgument(n > 0, "n must be positive");
        Request request = new Request("getMany");
        SessionCache session = new SessionCache(exclude);
        List<String> countryList = countries == null ? Collections.emptyList() : countries;

        int budget = budgetConfig.roundsFor(n);
        int stretchStart = budgetConfig.finalStretchStart(budget);
        Map<String, ValidatedProxy> collected = new LinkedHashMap<>();
        Predicate<ValidatedProxy> accept = anonymityFilter(anonymity);

        int round = 0;
        int executed = 0;
        while (collected.size() < n && round < budget) {
            executed++;
            boolean finalStretch = round >= stretchStart;
            int currentRound = round;
            request.recorder.recordEvent(() -> "getMany round " + currentRound + "/" + budget
                    + (finalStretch ? " (final stretch)" : "") + ", collected: " + collected.size() + "/" + n);

            request.transition(RotationState.FETCHING);
            List<CandidateProxy> fresh = Lists.newArrayList();
            int mismatched = 0;
            for (CandidateProxy candidate : fetchAll(countryList)) {
                if (hintMismatch(candidate, anonymity)) {
                    mismatched++;
                    continue;
                }
                if (session.markSeen(candidate)) {
                    fresh.add(candidate);
                }
            }
            request.recordMismatch(mismatched);

            List<CandidateProxy> toValidate = Lists.newArrayList(fresh);
            if (!finalStretch) {
                if (fresh.isEmpty()) {
                    request.recorder.recordEvent(() -> "no new candidates, fast forward to final stretch: " + stretchStart);
                    round = stretchStart;
                    continue;
                }
            } else {
                for (CandidateProxy retry : session.sampleRetry(collected.keySet(),
                        budgetConfig.getRetrySampleSize(), random)) {
                    if (!fresh.contains(retry)) {
                        toValidate.add(retry);
                    }
                }
                if (toValidate.isEmpty()) {
                    request.recorder.recordEvent("nothing to retry in final stretch, stop");
                    break;
                }
            }

            request.transition(RotationState.VALIDATING);
            List<ValidatedProxy> validated = validator.validateAll(toValidate, validator.isLenient(),
                    n - collected.size(), validateDeadline, accept, session::recordValidated);
            for (ValidatedProxy proxy : validated) {
                collected.putIfAbsent(proxy.getAddress(), proxy);
            }
            int got = validated.size();
            request.recorder.recordEvent(() -> "round finished, validated " + got + " of " + toValidate.size());
            round++;
        }

        List<ValidatedProxy> sorted = collected.values().stream()
                .sorted(Comparator.comparingDouble(ValidatedProxy::getLatencySeconds))
                .limit(n)
                .collect(Collectors.toList());
        RotationState state = sorted.size() >= n ? RotationState.SATISFIED : RotationState.EXHAUSTED;
        return request.finish(sorted, state, executed);
    }

    private List<CandidateProxy> fetchAll(List<String> countries) {
        if (countries.isEmpty()) {
            return fetchAndFilter(catalog.select(null), null, countries);
        }
        List<CandidateProxy> all = Lists.newArrayList();
        for (String country : countries) {
            all.addAll(fetcher.fetch(catalog.select(country), country, sourceTimeout, fetchDeadline));
        }
        return filter.filter(all, countries, maxCandidates);
    }

    private List<CandidateProxy> fetchAndFilter(List<SourceSpec> sources,
                                                @Nullable String country, List<String> allowlist) {
        List<CandidateProxy> candidates = fetcher.fetch(sources, country, sourceTimeout, fetchDeadline);
        return filter.filter(candidates, allowlist, maxCandidates);
    }

    /**
     * 代理源明确给出的匿名等级和要求不一致时，不需要探测直接跳过
     */
    private static boolean hintMismatch(CandidateProxy candidate, @Nullable Anonymity anonymity) {
        if (anonymity == null) {
            return false;
        }
        Anonymity hint = candidate.getAnonymityHint();
        return hint != null && hint != Anonymity.UNKNOWN && hint != anonymity;
    }

    private static Predicate<ValidatedProxy> anonymityFilter(@Nullable Anonymity anonymity) {
        if (anonymity == null) {
            return proxy -> true;
        }
        return proxy -> proxy.getAnonymity() == anonymity;
    }

    /**
     * 单次请求的状态，每次状态变化都会记录
     */
    private class Request {
        private final String name;
        private final Recorder recorder;
        private RotationState state = RotationState.IDLE;

        Request(String name) {
            this.name = name;
            this.recorder = DiskRecorders.ROTATION.acquireRecorder(
                    name + "_" + sessionSeq.incrementAndGet(), debug);
        }

        void transition(RotationState next) {
            if (state == next) {
                return;
            }
            RotationState prev = state;
            state = next;
            recorder.recordEvent(() -> name + " state: " + prev + " -> " + next);
        }

        void recordMismatch(int count) {
            if (count > 0) {
                recorder.recordEvent(() -> "skip " + count + " candidates before probing: " + DropReason.ANONYMITY_MISMATCH);
            }
        }

        RotationResult finish(List<ValidatedProxy> proxies, RotationState terminal, int rounds) {
            transition(terminal);
            RotationResult result = new RotationResult(proxies, terminal, rounds);
            recorder.recordEvent(() -> name + " finished: " + result);
            return result;
        }
    }
}
