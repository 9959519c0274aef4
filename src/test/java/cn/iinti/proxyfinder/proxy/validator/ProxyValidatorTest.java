package cn.iinti.proxyfinder.proxy.validator;

import cn.iinti.proxyfinder.resource.Anonymity;
import cn.iinti.proxyfinder.resource.CandidateProxy;
import cn.iinti.proxyfinder.resource.DropReason;
import cn.iinti.proxyfinder.resource.IpAndPort;
import cn.iinti.proxyfinder.resource.ValidatedProxy;
import cn.iinti.proxyfinder.resource.ValidationStatus;
import cn.iinti.proxyfinder.utils.AsyncHttpInvoker;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ProxyValidatorTest {
    private static final Clock clock = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);
    private static final List<String> echoURLs = Arrays.asList("http://echo-a.test/ip", "http://echo-b.test/ip");

    /**
     * 指定的地址连接失败，其余都可以连通
     */
    private static class StubReachability implements ReachabilityProbe {
        private final Set<String> unreachable = new HashSet<>();

        StubReachability unreachable(String... addresses) {
            unreachable.addAll(Arrays.asList(addresses));
            return this;
        }

        @Override
        public CompletableFuture<Void> connect(IpAndPort address, int timeoutMillis) {
            if (unreachable.contains(address.getIpPort())) {
                CompletableFuture<Void> future = new CompletableFuture<>();
                future.completeExceptionally(new ConnectException("connection refused"));
                return future;
            }
            return CompletableFuture.completedFuture(null);
        }
    }

    /**
     * 按 地址+url 返回预设的响应，未设置的抛出io异常
     */
    private static class StubFunctional implements FunctionalProbe {
        private final Map<String, AsyncHttpInvoker.HttpResult> responses = new HashMap<>();
        private final List<String> requested = new CopyOnWriteArrayList<>();

        StubFunctional respond(String address, String url, int status, String body) {
            responses.put(address + "|" + url, new AsyncHttpInvoker.HttpResult(status, body));
            return this;
        }

        @Override
        public CompletableFuture<AsyncHttpInvoker.HttpResult> get(IpAndPort proxy, String url, int timeoutMillis) {
            requested.add(proxy.getIpPort() + "|" + url);
            AsyncHttpInvoker.HttpResult result = responses.get(proxy.getIpPort() + "|" + url);
            CompletableFuture<AsyncHttpInvoker.HttpResult> future = new CompletableFuture<>();
            if (result == null) {
                future.completeExceptionally(new IOException("remotely closed"));
            } else {
                future.complete(result);
            }
            return future;
        }
    }

    private static ProxyValidator validator(ReachabilityProbe reachability, FunctionalProbe functional, boolean lenient) {
        return ProxyValidator.builder()
                .reachabilityProbe(reachability)
                .functionalProbe(functional)
                .echoURLs(echoURLs)
                .connectTimeout(1000)
                .probeTimeout(1000)
                .concurrency(4)
                .lenient(lenient)
                .clock(clock)
                .build();
    }

    @Test
    public void unreachableIsDropped() {
        StubFunctional functional = new StubFunctional();
        ProxyValidator validator = validator(new StubReachability().unreachable("1.1.1.1:80"), functional, true);
        ValidationResult result = validator.validate(new CandidateProxy("1.1.1.1:80"));
        assertFalse(result.isSuccess());
        assertEquals(DropReason.UNREACHABLE, result.getDropReason());
        // 连通性失败后不再做功能探测
        assertTrue(functional.requested.isEmpty());
    }

    @Test
    public void malformedIsDropped() {
        ProxyValidator validator = validator(new StubReachability(), new StubFunctional(), true);
        assertEquals(DropReason.MALFORMED, validator.validate(new CandidateProxy("nope")).getDropReason());
    }

    @Test
    public void firstSuccessfulEchoWins() {
        StubFunctional functional = new StubFunctional()
                .respond("2.2.2.2:80", "http://echo-a.test/ip", 502, "bad gateway")
                .respond("2.2.2.2:80", "http://echo-b.test/ip", 200, "{\"origin\":\"2.2.2.2\"}");
        CandidateProxy candidate = new CandidateProxy("2.2.2.2:80");
        candidate.setCountryHint("de");
        candidate.setSourceName("unit");

        ValidationResult result = validator(new StubReachability(), functional, false).validate(candidate);
        assertTrue(result.isSuccess());
        ValidatedProxy proxy = result.getProxy();
        assertNotNull(proxy);
        assertEquals(ValidationStatus.VALID, proxy.getStatus());
        assertEquals("DE", proxy.getCountry());
        assertEquals("2.2.2.2", proxy.getExitIp());
        assertEquals("unit", proxy.getSourceName());
        assertEquals(clock.millis(), proxy.getValidatedAt());
        assertTrue(proxy.getLatencySeconds() >= 0 && proxy.getLatencySeconds() < ProxyValidator.ELITE_LATENCY_SECONDS);
        // 没有匿名提示时按延迟推断
        assertEquals(Anonymity.ELITE, proxy.getAnonymity());
    }

    @Test
    public void anonymityHintIsKept() {
        StubFunctional functional = new StubFunctional()
                .respond("2.2.2.2:80", "http://echo-a.test/ip", 200, "2.2.2.2");
        CandidateProxy candidate = new CandidateProxy("2.2.2.2:80");
        candidate.setAnonymityHint(Anonymity.TRANSPARENT);
        ValidatedProxy proxy = validator(new StubReachability(), functional, true).validate(candidate).getProxy();
        assertNotNull(proxy);
        assertEquals(Anonymity.TRANSPARENT, proxy.getAnonymity());
        assertFalse(proxy.isAnonymityInferred());
    }

    @Test
    public void authRequired() {
        StubFunctional functional = new StubFunctional()
                .respond("3.3.3.3:80", "http://echo-a.test/ip", 407, "");
        CandidateProxy candidate = new CandidateProxy("3.3.3.3:80");

        ValidationResult lenient = validator(new StubReachability(), functional, true).validate(candidate);
        assertTrue(lenient.isSuccess());
        assertTrue(lenient.getProxy().isRequiresAuth());
        assertEquals(ValidationStatus.UNVALIDATED, lenient.getProxy().getStatus());
        // 407之后不再尝试其他回显接口
        assertEquals(Collections.singletonList("3.3.3.3:80|http://echo-a.test/ip"), functional.requested);

        ValidationResult strict = validator(new StubReachability(), functional, false).validate(candidate);
        assertFalse(strict.isSuccess());
        assertEquals(DropReason.AUTH_REQUIRED, strict.getDropReason());
    }

    @Test
    public void allEchoFailed() {
        CandidateProxy candidate = new CandidateProxy("4.4.4.4:80");

        ValidationResult lenient = validator(new StubReachability(), new StubFunctional(), true).validate(candidate);
        assertTrue(lenient.isSuccess());
        ValidatedProxy proxy = lenient.getProxy();
        assertEquals(ValidationStatus.UNVALIDATED, proxy.getStatus());
        assertEquals(ValidatedProxy.UNMEASURED_LATENCY, proxy.getLatencySeconds());
        assertEquals(Anonymity.TRANSPARENT, proxy.getAnonymity());
        assertNull(proxy.getExitIp());

        ValidationResult strict = validator(new StubReachability(), new StubFunctional(), false).validate(candidate);
        assertEquals(DropReason.NOT_FUNCTIONAL, strict.getDropReason());
    }

    @Test
    public void inferAnonymityByLatency() {
        assertEquals(Anonymity.ELITE, ProxyValidator.inferAnonymity(true, 1.5));
        assertEquals(Anonymity.ANONYMOUS, ProxyValidator.inferAnonymity(true, 2.0));
        assertEquals(Anonymity.ANONYMOUS, ProxyValidator.inferAnonymity(true, 4.99));
        assertEquals(Anonymity.TRANSPARENT, ProxyValidator.inferAnonymity(true, 5.0));
        assertEquals(Anonymity.TRANSPARENT, ProxyValidator.inferAnonymity(false, 0.1));
    }

    @Test
    public void validateAllStopsAtWanted() {
        StubFunctional functional = new StubFunctional();
        List<CandidateProxy> candidates = new ArrayList<>();
        for (int i = 1; i <= 10; i++) {
            String address = "5.5.5." + i + ":80";
            functional.respond(address, "http://echo-a.test/ip", 200, "5.5.5." + i);
            candidates.add(new CandidateProxy(address));
        }
        candidates.add(new CandidateProxy("5.5.5.1:80"));

        ProxyValidator validator = validator(new StubReachability(), functional, false);
        List<ValidatedProxy> three = validator.validateAll(candidates, false, 3, 5000, proxy -> true);
        assertEquals(3, three.size());

        List<ValidatedProxy> all = validator.validateAll(candidates, false, 100, 5000, proxy -> true);
        assertEquals(10, all.size());
        assertEquals(10, all.stream().map(ValidatedProxy::getAddress).distinct().count());
    }

    @Test
    public void validateAllAppliesAcceptAndSkipsFailures() {
        StubFunctional functional = new StubFunctional()
                .respond("6.6.6.1:80", "http://echo-a.test/ip", 200, "6.6.6.1");
        CandidateProxy elite = new CandidateProxy("6.6.6.1:80");
        CandidateProxy transparent = new CandidateProxy("6.6.6.2:80");
        transparent.setAnonymityHint(Anonymity.TRANSPARENT);
        functional.respond("6.6.6.2:80", "http://echo-a.test/ip", 200, "6.6.6.2");
        CandidateProxy dead = new CandidateProxy("6.6.6.3:80");

        ProxyValidator validator = validator(new StubReachability().unreachable("6.6.6.3:80"), functional, false);
        List<ValidatedProxy> ret = validator.validateAll(Arrays.asList(elite, transparent, dead), false, 10, 5000,
                proxy -> proxy.getAnonymity() == Anonymity.ELITE);
        assertEquals(1, ret.size());
        assertEquals("6.6.6.1:80", ret.get(0).getAddress());
    }

    @Test
    public void validateAllReportsRejectedResults() {
        StubFunctional functional = new StubFunctional()
                .respond("6.6.6.1:80", "http://echo-a.test/ip", 200, "6.6.6.1")
                .respond("6.6.6.2:80", "http://echo-a.test/ip", 200, "6.6.6.2");
        CandidateProxy elite = new CandidateProxy("6.6.6.1:80");
        CandidateProxy transparent = new CandidateProxy("6.6.6.2:80");
        transparent.setAnonymityHint(Anonymity.TRANSPARENT);
        CandidateProxy dead = new CandidateProxy("6.6.6.3:80");

        ProxyValidator validator = validator(new StubReachability().unreachable("6.6.6.3:80"), functional, false);
        List<ValidatedProxy> observed = new CopyOnWriteArrayList<>();
        List<ValidatedProxy> ret = validator.validateAll(Arrays.asList(elite, transparent, dead), false, 10, 5000,
                proxy -> proxy.getAnonymity() == Anonymity.ELITE, observed::add);

        assertEquals(1, ret.size());
        assertEquals(2, observed.size());
        assertTrue(observed.stream().anyMatch(proxy -> proxy.getAddress().equals("6.6.6.2:80")));
        assertTrue(observed.stream().filter(proxy -> proxy.getAddress().equals("6.6.6.1:80"))
                .allMatch(ValidatedProxy::isAnonymityInferred));
    }
}
