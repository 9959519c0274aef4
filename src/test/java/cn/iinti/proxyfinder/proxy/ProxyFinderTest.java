package cn.iinti.proxyfinder.proxy;

import cn.iinti.proxyfinder.exception.ConfigurationException;
import cn.iinti.proxyfinder.exception.ExhaustionException;
import cn.iinti.proxyfinder.proxy.cache.ProxyCache;
import cn.iinti.proxyfinder.proxy.diagnostics.Diagnostics;
import cn.iinti.proxyfinder.proxy.diagnostics.DiagnosticsReport;
import cn.iinti.proxyfinder.proxy.downloader.ConcurrentFetcher;
import cn.iinti.proxyfinder.proxy.downloader.SourceAdapter;
import cn.iinti.proxyfinder.proxy.downloader.SourceCatalog;
import cn.iinti.proxyfinder.proxy.downloader.SourceSpec;
import cn.iinti.proxyfinder.proxy.filter.CandidateFilter;
import cn.iinti.proxyfinder.proxy.rotation.RetryBudget;
import cn.iinti.proxyfinder.proxy.rotation.RotationManager;
import cn.iinti.proxyfinder.proxy.validator.FunctionalProbe;
import cn.iinti.proxyfinder.proxy.validator.ProxyValidator;
import cn.iinti.proxyfinder.proxy.validator.ReachabilityProbe;
import cn.iinti.proxyfinder.resource.Anonymity;
import cn.iinti.proxyfinder.resource.CandidateProxy;
import cn.iinti.proxyfinder.resource.IpAndPort;
import cn.iinti.proxyfinder.resource.ValidatedProxy;
import cn.iinti.proxyfinder.resource.ValidationStatus;
import cn.iinti.proxyfinder.testing.MutableClock;
import cn.iinti.proxyfinder.trace.Recorder;
import cn.iinti.proxyfinder.utils.AsyncHttpInvoker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ProxyFinderTest {
    @TempDir
    File tempDir;

    private final MutableClock clock = new MutableClock(1_700_000_000_000L);
    private final Set<String> working = ConcurrentHashMap.newKeySet();
    private final AtomicInteger fetchCount = new AtomicInteger();
    private final List<String> published = new ArrayList<>();
    private ProxyCache cache;
    private volatile boolean echoDown;

    /**
     * 所有地址都可以连通，working中的地址功能探测成功
     */
    private final ReachabilityProbe reachability = (address, timeoutMillis) -> CompletableFuture.completedFuture(null);
    private final FunctionalProbe functional = new FunctionalProbe() {
        @Override
        public CompletableFuture<AsyncHttpInvoker.HttpResult> get(IpAndPort proxy, String url, int timeoutMillis) {
            CompletableFuture<AsyncHttpInvoker.HttpResult> future = new CompletableFuture<>();
            if (working.contains(proxy.getIpPort())) {
                future.complete(new AsyncHttpInvoker.HttpResult(200, proxy.getIp()));
            } else {
                future.completeExceptionally(new IOException("remotely closed"));
            }
            return future;
        }
    };

    @BeforeEach
    public void setUp() {
        cache = new ProxyCache(new File(tempDir, "proxy_cache.json"), 200, clock, Recorder.nop);
    }

    private ProxyFinder finder(boolean withCache) {
        SourceAdapter adapter = (spec, country, timeoutMillis) -> {
            fetchCount.incrementAndGet();
            List<CandidateProxy> ret = new ArrayList<>();
            for (String address : published) {
                ret.add(new CandidateProxy(address));
            }
            return ret;
        };
        SourceCatalog catalog = new SourceCatalog(
                Collections.singletonList(SourceSpec.builder().name("unit").adapter(adapter).build()), 8);
        ConcurrentFetcher fetcher = new ConcurrentFetcher(Recorder.nop, clock);
        CandidateFilter filter = new CandidateFilter(Recorder.nop);
        ProxyValidator validator = ProxyValidator.builder()
                .reachabilityProbe(reachability)
                .functionalProbe(functional)
                .echoURLs(Collections.singletonList("http://echo.test/ip"))
                .connectTimeout(1000)
                .probeTimeout(1000)
                .concurrency(4)
                .lenient(false)
                .clock(clock)
                .build();
        RotationManager rotationManager = RotationManager.builder()
                .catalog(catalog)
                .fetcher(fetcher)
                .filter(filter)
                .validator(validator)
                .retryBudget(new RetryBudget(2, 0.2, 10))
                .maxRetries(2)
                .sourceTimeout(1000)
                .fetchDeadline(3000)
                .validateDeadline(5000)
                .maxCandidates(100)
                .random(new Random(3))
                .build();
        return ProxyFinder.builder()
                .catalog(catalog)
                .fetcher(fetcher)
                .filter(filter)
                .validator(validator)
                .rotationManager(rotationManager)
                .cache(withCache ? cache : null)
                .cacheMaxAgeHours(24)
                .sourceTimeout(1000)
                .fetchDeadline(3000)
                .validateDeadline(5000)
                .diagnostics(Diagnostics.builder()
                        .httpGet((url, timeoutMillis) -> echoDown
                                ? CompletableFuture.<AsyncHttpInvoker.HttpResult>failedFuture(new IOException("connection refused"))
                                : CompletableFuture.completedFuture(new AsyncHttpInvoker.HttpResult(200, "1.2.3.4")))
                        .echoURLs(validator.getEchoURLs())
                        .clock(clock)
                        .build())
                .build();
    }

    private ValidatedProxy cachedProxy(String address, String country, Anonymity anonymity) {
        return ValidatedProxy.builder()
                .address(address)
                .country(country)
                .anonymity(anonymity)
                .latencySeconds(0.3)
                .status(ValidationStatus.VALID)
                .validatedAt(clock.millis())
                .build();
    }

    private static List<String> addresses(List<ValidatedProxy> proxies) {
        return proxies.stream().map(ValidatedProxy::getAddress).collect(Collectors.toList());
    }

    @Test
    public void badInputRejectedBeforeNetwork() {
        ProxyFinder finder = finder(false);
        assertThrows(ConfigurationException.class, () -> finder.getMany(0, null, null));
        assertThrows(ConfigurationException.class, () -> finder.getMany(-2, null, null));
        assertThrows(ConfigurationException.class, () -> finder.getMany(1, Arrays.asList("US", "XX"), null));
        assertThrows(ConfigurationException.class, () -> finder.getMany(1, null, "invisible"));
        assertThrows(ConfigurationException.class, () -> finder.getOne(Collections.singletonList("ZZ"), null));
        assertEquals(0, fetchCount.get());
    }

    @Test
    public void exhaustionWhenNothingFound() {
        ProxyFinder finder = finder(false);
        published.add("9.0.0.1:80");
        ExhaustionException e = assertThrows(ExhaustionException.class, () -> finder.getMany(2, null, null));
        assertTrue(e.getRounds() > 0);
        assertThrows(ExhaustionException.class, () -> finder.getOne(null, null));
    }

    @Test
    public void partialResultIsReturned() {
        ProxyFinder finder = finder(false);
        published.addAll(Arrays.asList("9.0.0.1:80", "9.0.0.2:80", "9.0.0.3:80"));
        working.add("9.0.0.2:80");
        List<ValidatedProxy> proxies = finder.getMany(3, null, "elite");
        assertEquals(Collections.singletonList("9.0.0.2:80"), addresses(proxies));
    }

    @Test
    public void getOneReturnsWorkingProxy() {
        ProxyFinder finder = finder(false);
        published.addAll(Arrays.asList("9.0.0.1:80", "9.0.0.2:80"));
        working.add("9.0.0.1:80");
        assertEquals("9.0.0.1:80", finder.getOne(null, null).getAddress());
    }

    @Test
    public void fetchCandidatesDedupsAndLimits() {
        ProxyFinder finder = finder(false);
        published.addAll(Arrays.asList("9.0.0.1:80", "9.0.0.1:80", "bad", "9.0.0.2:80", "9.0.0.3:80"));
        List<CandidateProxy> candidates = finder.fetchCandidates(2);
        assertEquals(Arrays.asList("9.0.0.1:80", "9.0.0.2:80"),
                candidates.stream().map(CandidateProxy::getAddress).collect(Collectors.toList()));
    }

    @Test
    public void validateUsesConfiguredMode() {
        ProxyFinder finder = finder(false);
        assertTrue(finder.validate(new CandidateProxy("9.0.0.9:80")).getDropReason() != null);
        working.add("9.0.0.9:80");
        assertTrue(finder.validate(new CandidateProxy("9.0.0.9:80")).isSuccess());
    }

    @Test
    public void warmStartFromCacheAndSaveBack() {
        cache.save(Arrays.asList(
                cachedProxy("9.1.0.1:80", "US", Anonymity.ELITE),
                cachedProxy("9.1.0.2:80", "DE", Anonymity.ELITE),
                cachedProxy("9.1.0.3:80", "US", Anonymity.ELITE)));
        working.addAll(Arrays.asList("9.1.0.1:80", "9.1.0.2:80"));
        ProxyFinder finder = finder(true);

        List<ValidatedProxy> proxies = finder.getMany(1, Collections.singletonList("us"), null);
        assertEquals(Collections.singletonList("9.1.0.1:80"), addresses(proxies));
        // 缓存已经满足需求，不再抓取
        assertEquals(0, fetchCount.get());
        assertEquals(Collections.singletonList("9.1.0.1:80"), addresses(finder.cached(24)));
    }

    @Test
    public void cachedWithoutCacheIsEmpty() {
        assertTrue(finder(false).cached(24).isEmpty());
    }

    @Test
    public void warmStartAndRotationFillTogether() {
        published.addAll(Arrays.asList("9.1.0.1:80", "9.1.0.2:80"));
        working.addAll(Arrays.asList("9.1.0.1:80", "9.1.0.2:80"));
        for (int i = 0; i < 20; i++) {
            cache.save(Collections.singletonList(cachedProxy("9.1.0.1:80", "US", Anonymity.ELITE)));
            List<ValidatedProxy> proxies = finder(true).getMany(2, null, null);
            assertEquals(2, proxies.size());
            assertTrue(addresses(proxies).containsAll(Arrays.asList("9.1.0.1:80", "9.1.0.2:80")));
        }
    }

    @Test
    public void warmStartReinfersAnonymity() {
        // 上次探测较慢被推断为透明，这次探测很快
        ValidatedProxy slowLastTime = cachedProxy("9.1.0.1:80", "US", Anonymity.TRANSPARENT)
                .toBuilder().anonymityInferred(true).build();
        cache.save(Collections.singletonList(slowLastTime));
        working.add("9.1.0.1:80");

        List<ValidatedProxy> proxies = finder(true).getMany(1, null, "elite");
        assertEquals(Collections.singletonList("9.1.0.1:80"), addresses(proxies));
        assertEquals(Anonymity.ELITE, proxies.get(0).getAnonymity());
        assertTrue(proxies.get(0).isAnonymityInferred());
    }

    @Test
    public void warmStartKeepsSourceAnonymity() {
        cache.save(Collections.singletonList(cachedProxy("9.1.0.1:80", "US", Anonymity.TRANSPARENT)));
        working.add("9.1.0.1:80");

        ProxyFinder finder = finder(true);
        assertThrows(ExhaustionException.class, () -> finder.getMany(1, null, "elite"));
        List<ValidatedProxy> proxies = finder.getMany(1, null, "transparent");
        assertEquals(Anonymity.TRANSPARENT, proxies.get(0).getAnonymity());
    }

    @Test
    public void diagnoseChecksEchoEndpointsDirectly() {
        ProxyFinder finder = finder(false);
        DiagnosticsReport report = finder.diagnose();
        assertEquals(1, report.getTotalCount());
        assertEquals(1, report.getWorkingCount());
        assertEquals("http://echo.test/ip", report.getEchoEndpoints().get(0).getUrl());

        echoDown = true;
        assertEquals(0, finder.diagnose().getWorkingCount());
        assertEquals(0, fetchCount.get());
    }
}
