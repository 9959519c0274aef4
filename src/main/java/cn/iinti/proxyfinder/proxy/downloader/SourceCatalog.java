package cn.iinti.proxyfinder.proxy.downloader;

import cn.iinti.proxyfinder.Settings;
import cn.iinti.proxyfinder.trace.Recorder;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 所有已配置的代理源，以及每次下载时的选源策略
 */
public class SourceCatalog {
    private final List<SourceSpec> sources;
    private final int maxSources;

    public SourceCatalog(List<SourceSpec> sources, int maxSources) {
        this.sources = ImmutableList.copyOf(sources);
        this.maxSources = maxSources;
    }

    public static SourceCatalog fromSettings(Settings settings, Recorder recorder) {
        List<SourceSpec> specs = settings.getIpSourceList().stream()
                .filter(ipSource -> ipSource.enable.value)
                .filter(ipSource -> StringUtils.isNotBlank(ipSource.loadURL.value))
                .map(ipSource -> HttpSourceAdapter.fromConfig(ipSource, recorder))
                .collect(Collectors.toList());
        return new SourceCatalog(specs, settings.getGlobal().maxSources.value);
    }

    public List<SourceSpec> all() {
        return sources;
    }

    public boolean isEmpty() {
        return sources.isEmpty();
    }

    /**
     * 按优先级排序，指定国家时同优先级下支持国家过滤的源排前面，最后截断到maxSources
     */
    public List<SourceSpec> select(@Nullable String country) {
        List<SourceSpec> ret = new ArrayList<>(sources);
        Comparator<SourceSpec> comparator = Comparator.comparingInt(SourceSpec::getPriority);
        if (StringUtils.isNotBlank(country)) {
            comparator = comparator.thenComparing(spec -> spec.isCountrySupported() ? 0 : 1);
        }
        // List.sort 是稳定排序，配置顺序作为最后的排序依据
        ret.sort(comparator);
        if (maxSources > 0 && ret.size() > maxSources) {
            return new ArrayList<>(ret.subList(0, maxSources));
        }
        return ret;
    }
}
