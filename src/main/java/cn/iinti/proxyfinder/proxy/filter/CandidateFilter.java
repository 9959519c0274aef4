package cn.iinti.proxyfinder.proxy.filter;

import cn.iinti.proxyfinder.resource.CandidateProxy;
import cn.iinti.proxyfinder.resource.DropReason;
import cn.iinti.proxyfinder.resource.IpAndPort;
import cn.iinti.proxyfinder.trace.Recorder;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 候选代理清洗：格式检查 -> 去重 -> 国家过滤 -> 数量截断，顺序固定
 */
public class CandidateFilter {
    private final Recorder recorder;

    public CandidateFilter(Recorder recorder) {
        this.recorder = recorder;
    }

    /**
     * @param countryAllowlist 为空表示不限制国家
     * @param maxCount         小于等于0表示不限制数量
     * @return 过滤后的候选，保持输入顺序；没有任何命中时返回空列表
     */
    public List<CandidateProxy> filter(List<CandidateProxy> candidates,
                                       @Nullable Collection<String> countryAllowlist,
                                       int maxCount) {
        List<CandidateProxy> ret = Lists.newArrayList();
        if (candidates == null || candidates.isEmpty()) {
            return ret;
        }
        Set<String> allowlist = normalizeAllowlist(countryAllowlist);
        Set<String> seen = Sets.newHashSet();
        Map<DropReason, Integer> dropped = new EnumMap<>(DropReason.class);

        for (CandidateProxy candidate : candidates) {
            if (candidate == null) {
                continue;
            }
            if (IpAndPort.parse(candidate.getAddress()) == null) {
                drop(dropped, DropReason.MALFORMED);
                continue;
            }
            if (!seen.add(candidate.getAddress())) {
                drop(dropped, DropReason.DUPLICATE);
                continue;
            }
            if (!allowlist.isEmpty() && !matchCountry(candidate, allowlist)) {
                drop(dropped, DropReason.COUNTRY_MISMATCH);
                continue;
            }
            if (maxCount > 0 && ret.size() >= maxCount) {
                drop(dropped, DropReason.OVERFLOW);
                continue;
            }
            ret.add(candidate);
        }

        recorder.recordEvent(() -> "filter candidates: " + candidates.size() + " -> " + ret.size()
                + ", dropped: " + dropped);
        return ret;
    }

    private static boolean matchCountry(CandidateProxy candidate, Set<String> allowlist) {
        if (candidate.isCountryKnown()) {
            return allowlist.contains(candidate.getCountryHint().trim().toUpperCase(Locale.ROOT));
        }
        String guessed = CountryHeuristic.guess(candidate.getAddress());
        candidate.setCountryHint(guessed);
        return allowlist.contains(guessed);
    }

    private static Set<String> normalizeAllowlist(@Nullable Collection<String> countryAllowlist) {
        Set<String> ret = Sets.newHashSet();
        if (countryAllowlist == null) {
            return ret;
        }
        for (String country : countryAllowlist) {
            if (country != null && !country.isBlank()) {
                ret.add(country.trim().toUpperCase(Locale.ROOT));
            }
        }
        return ret;
    }

    private static void drop(Map<DropReason, Integer> dropped, DropReason reason) {
        dropped.merge(reason, 1, Integer::sum);
    }
}
