package cn.iinti.proxyfinder.proxy.downloader;

import cn.iinti.proxyfinder.exception.SourceUnavailableException;
import cn.iinti.proxyfinder.resource.CandidateProxy;
import cn.iinti.proxyfinder.trace.Recorder;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConcurrentFetcherTest {
    private static final Clock clock = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);

    private final ConcurrentFetcher fetcher = new ConcurrentFetcher(Recorder.nop, clock);

    private static SourceSpec source(String name, SourceAdapter adapter) {
        return SourceSpec.builder().name(name).adapter(adapter).build();
    }

    private static SourceAdapter returning(long delayMillis, String... addresses) {
        return (spec, country, timeoutMillis) -> {
            if (delayMillis > 0) {
                try {
                    Thread.sleep(delayMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new SourceUnavailableException(spec.getName(), "interrupted");
                }
            }
            List<CandidateProxy> ret = new ArrayList<>();
            for (String address : addresses) {
                ret.add(new CandidateProxy(address));
            }
            return ret;
        };
    }

    private static SourceAdapter hanging() {
        return returning(60_000, "6.6.6.6:80");
    }

    private static List<String> addresses(List<CandidateProxy> candidates) {
        return candidates.stream().map(CandidateProxy::getAddress).sorted().collect(Collectors.toList());
    }

    @Test
    public void emptySources() {
        assertTrue(fetcher.fetch(Collections.emptyList(), 1000, 1000).isEmpty());
        assertTrue(fetcher.fetch(null, 1000, 1000).isEmpty());
    }

    @Test
    public void mergeAllSources() {
        List<CandidateProxy> ret = fetcher.fetch(Arrays.asList(
                source("a", returning(0, "1.1.1.1:80", "2.2.2.2:80")),
                source("b", returning(50, "3.3.3.3:80"))), 1000, 5000);
        assertEquals(Arrays.asList("1.1.1.1:80", "2.2.2.2:80", "3.3.3.3:80"), addresses(ret));
        for (CandidateProxy candidate : ret) {
            assertEquals(clock.millis(), candidate.getFetchedAt());
        }
        assertEquals("b", ret.stream().filter(c -> c.getAddress().startsWith("3.")).findFirst().get().getSourceName());
    }

    @Test
    public void hungSourceDoesNotBlockOthers() {
        long start = System.currentTimeMillis();
        List<CandidateProxy> ret = fetcher.fetch(Arrays.asList(
                source("hung", hanging()),
                source("fast", returning(100, "1.1.1.1:80"))), 500, 2000);
        long cost = System.currentTimeMillis() - start;

        assertEquals(Collections.singletonList("1.1.1.1:80"), addresses(ret));
        assertTrue(cost < 2000, "cost: " + cost);
    }

    @Test
    public void globalDeadlineAbandonsRunningSources() {
        long start = System.currentTimeMillis();
        List<CandidateProxy> ret = fetcher.fetch(Arrays.asList(
                source("hung", hanging()),
                source("fast", returning(100, "1.1.1.1:80"))), 30_000, 1000);
        long cost = System.currentTimeMillis() - start;

        assertEquals(Collections.singletonList("1.1.1.1:80"), addresses(ret));
        assertTrue(cost < 1800, "cost: " + cost);
    }

    @Test
    public void failedSourceIsAbsorbed() {
        SourceAdapter broken = (spec, country, timeoutMillis) -> {
            throw new SourceUnavailableException(spec.getName(), "http status: 503");
        };
        SourceAdapter crashing = (spec, country, timeoutMillis) -> {
            throw new IllegalStateException("boom");
        };
        List<CandidateProxy> ret = fetcher.fetch(Arrays.asList(
                source("broken", broken),
                source("crashing", crashing),
                source("ok", returning(0, "1.1.1.1:80"))), 1000, 3000);
        assertEquals(Collections.singletonList("1.1.1.1:80"), addresses(ret));
    }

    @Test
    public void countryOnlyPassedToSupportingSources() {
        AtomicReference<String> supportingCountry = new AtomicReference<>();
        AtomicReference<String> plainCountry = new AtomicReference<>("untouched");
        SourceSpec supporting = SourceSpec.builder().name("geo").countrySupported(true)
                .adapter((spec, country, timeoutMillis) -> {
                    supportingCountry.set(country);
                    return Collections.emptyList();
                }).build();
        SourceSpec plain = source("plain", (spec, country, timeoutMillis) -> {
            plainCountry.set(country);
            return Collections.emptyList();
        });

        fetcher.fetch(Arrays.asList(supporting, plain), "DE", 1000, 3000);
        assertEquals("DE", supportingCountry.get());
        assertNull(plainCountry.get());
    }
}
