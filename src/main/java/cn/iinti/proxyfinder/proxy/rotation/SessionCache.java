package cn.iinti.proxyfinder.proxy.rotation;

import cn.iinti.proxyfinder.resource.CandidateProxy;
import cn.iinti.proxyfinder.resource.ValidatedProxy;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 单次轮换请求内的缓存，只在请求线程内访问，请求结束即丢弃。
 * <p>
 * 探测成功的结果按地址记录下来，同一个请求内不会再次探测；探测失败的地址不记录，后续轮次可以重试
 */
class SessionCache {
    /**
     * 本次会话见过的所有候选，保持首次出现的顺序
     */
    private final Map<String, CandidateProxy> seen = Maps.newLinkedHashMap();

    private final Map<String, ValidatedProxy> validated = Maps.newHashMap();

    /**
     * 调用方已经持有的地址，既不作为新候选也不参与重试
     */
    private final Set<String> excluded;

    SessionCache() {
        this(Collections.emptySet());
    }

    SessionCache(Collection<String> excluded) {
        this.excluded = excluded == null ? Collections.emptySet() : ImmutableSet.copyOf(excluded);
    }

    /**
     * @return 第一次见到返回true，被排除的地址总是返回false
     */
    boolean markSeen(CandidateProxy candidate) {
        if (excluded.contains(candidate.getAddress())) {
            return false;
        }
        return seen.putIfAbsent(candidate.getAddress(), candidate) == null;
    }

    void recordValidated(ValidatedProxy proxy) {
        validated.put(proxy.getAddress(), proxy);
    }

    @Nullable
    ValidatedProxy lookup(String address) {
        return validated.get(address);
    }

    /**
     * 从见过但是没有被收集的候选里随机抽取最多 sampleSize 个，用于冲刺阶段重试。
     * 已经探测成功的地址（被匿名条件拒绝）直接复用缓存结果，不进入重试
     */
    List<CandidateProxy> sampleRetry(Set<String> collected, int sampleSize, Random random) {
        List<CandidateProxy> pool = seen.values().stream()
                .filter(candidate -> !collected.contains(candidate.getAddress()))
                .filter(candidate -> lookup(candidate.getAddress()) == null)
                .collect(Collectors.toList());
        if (pool.size() > sampleSize) {
            Collections.shuffle(pool, random);
            return Lists.newArrayList(pool.subList(0, sampleSize));
        }
        return pool;
    }
}
