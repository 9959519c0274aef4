package cn.iinti.proxyfinder.proxy.downloader;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class SourceCatalogTest {
    private static final SourceAdapter empty = (spec, country, timeoutMillis) -> Collections.emptyList();

    private static SourceSpec source(String name, int priority, boolean countrySupported) {
        return SourceSpec.builder().name(name).priority(priority).countrySupported(countrySupported)
                .adapter(empty).build();
    }

    private static List<String> names(List<SourceSpec> specs) {
        return specs.stream().map(SourceSpec::getName).collect(Collectors.toList());
    }

    private final SourceCatalog catalog = new SourceCatalog(Arrays.asList(
            source("slow", 3, false),
            source("plain", 1, false),
            source("geo", 1, true),
            source("mid", 2, true)), 3);

    @Test
    public void sortByPriorityAndLimit() {
        assertEquals(Arrays.asList("plain", "geo", "mid"), names(catalog.select(null)));
    }

    @Test
    public void countrySupportingFirstWhenCountryRequested() {
        assertEquals(Arrays.asList("geo", "plain", "mid"), names(catalog.select("DE")));
    }

    @Test
    public void unlimited() {
        SourceCatalog all = new SourceCatalog(catalog.all(), 0);
        assertEquals(4, all.select(null).size());
    }
}
