package cn.iinti.proxyfinder.proxy.downloader;

import cn.iinti.proxyfinder.Settings;
import cn.iinti.proxyfinder.exception.SourceUnavailableException;
import cn.iinti.proxyfinder.resource.CandidateProxy;
import cn.iinti.proxyfinder.resource.IpResourceParser;
import cn.iinti.proxyfinder.trace.Recorder;
import cn.iinti.proxyfinder.utils.AsyncHttpInvoker;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nullable;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 通过http下载代理列表，loadURL 不是http链接时直接把它当作列表内容解析
 */
public class HttpSourceAdapter implements SourceAdapter {
    private static final String COUNTRY_PLACEHOLDER = "{country}";

    private final String loadURL;
    private final IpResourceParser resourceParser;
    private final String countryWildcard;
    private final Recorder recorder;

    public HttpSourceAdapter(String loadURL, IpResourceParser resourceParser, String countryWildcard, Recorder recorder) {
        this.loadURL = loadURL;
        this.resourceParser = resourceParser;
        this.countryWildcard = StringUtils.defaultString(countryWildcard);
        this.recorder = recorder;
    }

    public static SourceSpec fromConfig(Settings.IpSource ipSource, Recorder recorder) {
        HttpSourceAdapter adapter = new HttpSourceAdapter(
                ipSource.loadURL.value,
                IpResourceParser.resolve(ipSource.resourceFormat.value),
                ipSource.countryWildcard.value,
                recorder
        );
        return SourceSpec.builder()
                .name(ipSource.name)
                .countrySupported(ipSource.countrySupported.value)
                .priority(ipSource.priority.value)
                .adapter(adapter)
                .build();
    }

    @Override
    public List<CandidateProxy> fetch(SourceSpec spec, @Nullable String country, int timeoutMillis) {
        String url = resolveURL(country);
        if (!isHTTPLink(url)) {
            return parse(spec, url);
        }

        CompletableFuture<AsyncHttpInvoker.HttpResult> future = AsyncHttpInvoker.get(url, recorder, timeoutMillis);
        AsyncHttpInvoker.HttpResult httpResult;
        try {
            httpResult = future.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new SourceUnavailableException(spec.getName(), "download timeout after " + timeoutMillis + "ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException(spec.getName(), "download interrupted");
        } catch (ExecutionException e) {
            throw new SourceUnavailableException(spec.getName(), "download failed", e.getCause());
        }

        if (!httpResult.isSuccess()) {
            throw new SourceUnavailableException(spec.getName(), "http status: " + httpResult.getStatusCode());
        }
        if (StringUtils.isBlank(httpResult.getBody())) {
            throw new SourceUnavailableException(spec.getName(), "empty response");
        }
        return parse(spec, httpResult.getBody());
    }

    String resolveURL(@Nullable String country) {
        String replacement = StringUtils.isBlank(country) ? countryWildcard : country;
        return StringUtils.replace(loadURL, COUNTRY_PLACEHOLDER, replacement);
    }

    private List<CandidateProxy> parse(SourceSpec spec, String content) {
        try {
            List<CandidateProxy> candidates = resourceParser.parse(content);
            for (CandidateProxy candidate : candidates) {
                candidate.setSourceName(spec.getName());
            }
            return candidates;
        } catch (RuntimeException e) {
            throw new SourceUnavailableException(spec.getName(), "can not parse response", e);
        }
    }

    @SuppressWarnings("all")
    private static boolean isHTTPLink(String url) {
        return StringUtils.startsWithAny(url, "http://", "https://");
    }
}
