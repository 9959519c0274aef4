package cn.iinti.proxyfinder.proxy;

import cn.iinti.proxyfinder.Settings;
import cn.iinti.proxyfinder.exception.ConfigurationException;
import cn.iinti.proxyfinder.exception.ExhaustionException;
import cn.iinti.proxyfinder.exception.ProxyFinderException;
import cn.iinti.proxyfinder.proxy.cache.ProxyCache;
import cn.iinti.proxyfinder.proxy.diagnostics.Diagnostics;
import cn.iinti.proxyfinder.proxy.diagnostics.DiagnosticsReport;
import cn.iinti.proxyfinder.proxy.downloader.ConcurrentFetcher;
import cn.iinti.proxyfinder.proxy.downloader.SourceCatalog;
import cn.iinti.proxyfinder.proxy.downloader.SourceSpec;
import cn.iinti.proxyfinder.proxy.filter.CandidateFilter;
import cn.iinti.proxyfinder.proxy.rotation.RetryBudget;
import cn.iinti.proxyfinder.proxy.rotation.RotationManager;
import cn.iinti.proxyfinder.proxy.rotation.RotationResult;
import cn.iinti.proxyfinder.proxy.validator.ProxyValidator;
import cn.iinti.proxyfinder.proxy.validator.ValidationResult;
import cn.iinti.proxyfinder.resource.Anonymity;
import cn.iinti.proxyfinder.resource.CandidateProxy;
import cn.iinti.proxyfinder.resource.ValidatedProxy;
import cn.iinti.proxyfinder.trace.impl.DiskRecorders;
import cn.iinti.proxyfinder.utils.CountryCodes;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nullable;
import java.io.File;
import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 代理发现流水线的入口：抓取 → 过滤 → 探测 → 轮换，可选本地缓存。
 * <p>
 * 所有调用参数（国家代码、匿名等级、数量）都在发起网络请求之前校验，非法输入抛出 {@link ConfigurationException}
 */
@Slf4j
public class ProxyFinder {
    private static final String CACHE_SOURCE_NAME = "cache";

    @Getter
    private final SourceCatalog catalog;
    private final ConcurrentFetcher fetcher;
    private final CandidateFilter filter;
    @Getter
    private final ProxyValidator validator;
    private final RotationManager rotationManager;
    @Nullable
    private final ProxyCache cache;
    private final int cacheMaxAgeHours;
    private final int sourceTimeout;
    private final long fetchDeadline;
    private final long validateDeadline;
    private final Diagnostics diagnostics;

    @Builder
    public ProxyFinder(SourceCatalog catalog, ConcurrentFetcher fetcher, CandidateFilter filter,
                       ProxyValidator validator, RotationManager rotationManager, @Nullable ProxyCache cache,
                       int cacheMaxAgeHours, int sourceTimeout, long fetchDeadline, long validateDeadline,
                       @Nullable Diagnostics diagnostics) {
        this.catalog = Preconditions.checkNotNull(catalog, "catalog");
        this.fetcher = Preconditions.checkNotNull(fetcher, "fetcher");
        this.filter = Preconditions.checkNotNull(filter, "filter");
        this.validator = Preconditions.checkNotNull(validator, "validator");
        this.rotationManager = Preconditions.checkNotNull(rotationManager, "rotationManager");
        this.cache = cache;
        this.cacheMaxAgeHours = cacheMaxAgeHours > 0 ? cacheMaxAgeHours : 24;
        this.sourceTimeout = sourceTimeout > 0 ? sourceTimeout : 10_000;
        this.fetchDeadline = fetchDeadline > 0 ? fetchDeadline : 30_000;
        this.validateDeadline = validateDeadline > 0 ? validateDeadline : 60_000;
        this.diagnostics = diagnostics == null
                ? Diagnostics.builder().echoURLs(validator.getEchoURLs()).build()
                : diagnostics;
    }

    public static ProxyFinder create(Settings settings) {
        return create(settings, Clock.systemUTC());
    }

    public static ProxyFinder create(Settings settings, Clock clock) {
        Settings.Global global = settings.getGlobal();
        boolean debug = global.debug.value;

        SourceCatalog catalog = SourceCatalog.fromSettings(settings,
                DiskRecorders.SOURCE_FETCH.acquireRecorder("http_source", debug));
        if (catalog.isEmpty()) {
            log.warn("no enabled proxy source configured");
        }
        ConcurrentFetcher fetcher = new ConcurrentFetcher(
                DiskRecorders.SOURCE_FETCH.acquireRecorder("fetcher", debug), clock);
        CandidateFilter filter = new CandidateFilter(DiskRecorders.FILTER.acquireRecorder("filter", debug));
        ProxyValidator validator = ProxyValidator.builder()
                .echoURLs(global.echoURLs.value)
                .connectTimeout(global.connectTimeout.value)
                .probeTimeout(global.probeTimeout.value)
                .concurrency(global.validateConcurrency.value)
                .lenient(global.lenientValidation.value)
                .debug(debug)
                .clock(clock)
                .build();
        RotationManager rotationManager = RotationManager.builder()
                .catalog(catalog)
                .fetcher(fetcher)
                .filter(filter)
                .validator(validator)
                .retryBudget(new RetryBudget(global.maxAttemptsPerProxy.value,
                        global.finalStretchRatio.value, global.retrySampleSize.value))
                .maxRetries(global.maxRetries.value)
                .sourceTimeout(global.sourceTimeout.value)
                .fetchDeadline(global.fetchDeadline.value)
                .validateDeadline(global.validateDeadline.value)
                .maxCandidates(global.maxCandidates.value)
                .random(new Random())
                .debug(debug)
                .build();

        ProxyCache cache = null;
        if (global.useCache.value) {
            File cacheFile = StringUtils.isBlank(global.cacheFile.value)
                    ? ProxyCache.defaultCacheFile()
                    : new File(global.cacheFile.value);
            cache = new ProxyCache(cacheFile, global.cacheCapacity.value, clock,
                    DiskRecorders.CACHE.acquireRecorder("proxy_cache", debug));
        }

        Diagnostics diagnostics = Diagnostics.builder()
                .connectivityURLs(global.connectivityURLs.value)
                .echoURLs(global.echoURLs.value)
                .timeoutMillis(global.connectTimeout.value)
                .recorder(DiskRecorders.DIAGNOSTICS.acquireRecorder("diagnostics", debug))
                .clock(clock)
                .build();

        return ProxyFinder.builder()
                .catalog(catalog)
                .fetcher(fetcher)
                .filter(filter)
                .validator(validator)
                .rotationManager(rotationManager)
                .cache(cache)
                .cacheMaxAgeHours(global.cacheMaxAgeHours.value)
                .sourceTimeout(global.sourceTimeout.value)
                .fetchDeadline(global.fetchDeadline.value)
                .validateDeadline(global.validateDeadline.value)
                .diagnostics(diagnostics)
                .build();
    }

    /**
     * 从指定的源抓取候选并去重，不做国家过滤
     */
    public List<CandidateProxy> fetchCandidates(List<SourceSpec> sources, int maxCount) {
        List<CandidateProxy> candidates = fetcher.fetch(sources, sourceTimeout, fetchDeadline);
        return filter.filter(candidates, null, maxCount);
    }

    public List<CandidateProxy> fetchCandidates(int maxCount) {
        return fetchCandidates(catalog.select(null), maxCount);
    }

    public ValidationResult validate(CandidateProxy candidate) {
        return validator.validate(candidate);
    }

    public ValidatedProxy getOne(@Nullable Collection<String> countries, @Nullable String anonymity) {
        List<String> countryList = CountryCodes.normalize(countries);
        Anonymity want = Anonymity.fromUserInput(anonymity);

        RotationResult result = rotationManager.getOne(countryList, want);
        if (result.isEmpty()) {
            throw new ExhaustionException("no working proxy found after " + result.getRounds()
                    + " rounds, countries: " + countryList + ", anonymity: " + want, result.getRounds());
        }
        return result.getProxies().get(0);
    }

    /**
     * 获取n个可用代理，按延迟升序。只找到一部分时原样返回，一个都没有找到时抛出 {@link ExhaustionException}
     */
    public List<ValidatedProxy> getMany(int n, @Nullable Collection<String> countries, @Nullable String anonymity) {
        if (n <= 0) {
            throw new ConfigurationException("proxy count must be positive, got: " + n);
        }
        List<String> countryList = CountryCodes.normalize(countries);
        Anonymity want = Anonymity.fromUserInput(anonymity);

        Map<String, ValidatedProxy> collected = new LinkedHashMap<>();
        for (ValidatedProxy proxy : warmStart(n, countryList, want)) {
            collected.putIfAbsent(proxy.getAddress(), proxy);
        }
        int rounds = 0;
        if (collected.size() < n) {
            // 预热得到的地址交给轮换排除，轮换只负责补齐剩余的数量
            RotationResult result = rotationManager.getMany(n - collected.size(), countryList, want,
                    collected.keySet());
            rounds = result.getRounds();
            for (ValidatedProxy proxy : result.getProxies()) {
                collected.putIfAbsent(proxy.getAddress(), proxy);
            }
        }
        if (collected.isEmpty()) {
            throw new ExhaustionException("no working proxy found after " + rounds
                    + " rounds, countries: " + countryList + ", anonymity: " + want, rounds);
        }

        List<ValidatedProxy> ret = collected.values().stream()
                .sorted(Comparator.comparingDouble(ValidatedProxy::getLatencySeconds))
                .limit(n)
                .collect(Collectors.toList());
        if (ret.size() < n) {
            log.info("only {} of {} requested proxies found", ret.size(), n);
        }
        saveToCache(ret);
        return ret;
    }

    /**
     * 直连检查本机网络和回显接口，不经过任何代理
     */
    public DiagnosticsReport diagnose() {
        return diagnostics.run();
    }

    /**
     * 读取缓存中未过期的代理，没有开启缓存时返回空
     */
    public List<ValidatedProxy> cached(int maxAgeHours) {
        if (cache == null) {
            return Collections.emptyList();
        }
        return cache.load(maxAgeHours);
    }

    /**
     * 缓存中符合条件的代理重新探测一遍，仍然可用的直接作为结果的一部分。
     * 只有代理源给出的匿名等级会作为提示沿用
     */
    private List<ValidatedProxy> warmStart(int n, List<String> countries, @Nullable Anonymity want) {
        if (cache == null) {
            return Collections.emptyList();
        }
        List<CandidateProxy> candidates = Lists.newArrayList();
        for (ValidatedProxy proxy : cache.load(cacheMaxAgeHours)) {
            if (!countries.isEmpty() && !countries.contains(proxy.getCountry().toUpperCase())) {
                continue;
            }
            // 推断出来的匿名等级会随着这次探测的延迟重新计算，不能提前过滤
            if (want != null && !proxy.isAnonymityInferred() && proxy.getAnonymity() != want) {
                continue;
            }
            CandidateProxy candidate = new CandidateProxy(proxy.getAddress());
            candidate.setCountryHint(proxy.getCountry());
            candidate.setAnonymityHint(proxy.isAnonymityInferred() ? Anonymity.UNKNOWN : proxy.getAnonymity());
            candidate.setSourceName(StringUtils.defaultIfBlank(proxy.getSourceName(), CACHE_SOURCE_NAME));
            candidate.setFetchedAt(proxy.getValidatedAt());
            candidates.add(candidate);
        }
        if (candidates.isEmpty()) {
            return Collections.emptyList();
        }
        Predicate<ValidatedProxy> accept = want == null ? proxy -> true : proxy -> proxy.getAnonymity() == want;
        List<ValidatedProxy> revalidated = validator.validateAll(candidates, validator.isLenient(), n,
                validateDeadline, accept);
        log.info("warm start from cache: {} of {} cached proxies still working", revalidated.size(), candidates.size());
        return revalidated;
    }

    private void saveToCache(List<ValidatedProxy> proxies) {
        if (cache == null) {
            return;
        }
        try {
            cache.save(proxies);
        } catch (ProxyFinderException e) {
            // 缓存写入失败不影响本次结果
            log.warn("failed to save proxy cache", e);
        }
    }
}
