package cn.iinti.proxyfinder.resource;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import javax.annotation.Nullable;

/**
 * 通过探测的代理，轮换和缓存都以它为准
 */
@Getter
@Builder(toBuilder = true)
@EqualsAndHashCode
@ToString
public class ValidatedProxy {

    /**
     * 宽松模式下功能探测全部失败时使用的延迟，保证排序时排在最后
     */
    public static final double UNMEASURED_LATENCY = 999.99;

    private final String address;

    private final String country;

    private final Anonymity anonymity;

    /**
     * 匿名等级是根据延迟推断出来的，而不是代理源给出的。再次探测时推断值需要重新计算
     */
    private final boolean anonymityInferred;

    /**
     * 成功的那次功能探测的耗时，单位秒
     */
    private final double latencySeconds;

    private final boolean requiresAuth;

    private final ValidationStatus status;

    private final long validatedAt;

    /**
     * 回显接口看到的出口ip，无法解析时为空
     */
    @Nullable
    private final String exitIp;

    @Nullable
    private final String sourceName;

    public boolean isValid() {
        return status == ValidationStatus.VALID;
    }
}
