package cn.iinti.proxyfinder.proxy.rotation;

import com.google.common.base.Preconditions;
import lombok.Getter;

/**
 * 批量获取时的重试预算：总轮数 = maxAttemptsPerProxy * n。
 * 预算最后 finalStretchRatio 比例的轮次为冲刺阶段，此时允许重新探测本次会话已经见过但是没有收集到的候选。
 * 这几个参数都是经验值，没有理论依据，按需调整
 */
@Getter
public class RetryBudget {
    public static final RetryBudget DEFAULT = new RetryBudget(10, 0.2, 10);

    private final int maxAttemptsPerProxy;
    private final double finalStretchRatio;
    private final int retrySampleSize;

    public RetryBudget(int maxAttemptsPerProxy, double finalStretchRatio, int retrySampleSize) {
        Preconditions.checkArgument(maxAttemptsPerProxy > 0, "maxAttemptsPerProxy must be positive");
        Preconditions.checkArgument(finalStretchRatio >= 0 && finalStretchRatio <= 1,
                "finalStretchRatio must between 0 and 1");
        Preconditions.checkArgument(retrySampleSize >= 0, "retrySampleSize can not be negative");
        this.maxAttemptsPerProxy = maxAttemptsPerProxy;
        this.finalStretchRatio = finalStretchRatio;
        this.retrySampleSize = retrySampleSize;
    }

    public int roundsFor(int wanted) {
        return maxAttemptsPerProxy * Math.max(wanted, 1);
    }

    /**
     * 冲刺阶段的起始轮次（从0开始计数），round >= 该值即处于冲刺阶段
     */
    public int finalStretchStart(int budget) {
        // 减去一个极小值，避免 30 * 0.8 = 24.000000000000004 被向上取整成25
        return (int) Math.ceil(budget * (1 - finalStretchRatio) - 1e-9);
    }
}
