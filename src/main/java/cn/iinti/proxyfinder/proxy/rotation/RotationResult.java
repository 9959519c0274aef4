package cn.iinti.proxyfinder.proxy.rotation;

import cn.iinti.proxyfinder.resource.ValidatedProxy;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import lombok.Getter;

import java.util.List;

@Getter
public class RotationResult {
    private final List<ValidatedProxy> proxies;
    private final RotationState state;
    /**
     * 实际执行的轮数，快进跳过的轮次不计入
     */
    private final int rounds;

    public RotationResult(List<ValidatedProxy> proxies, RotationState state, int rounds) {
        Preconditions.checkArgument(state.isTerminal(), "rotation result must be terminal: %s", state);
        this.proxies = ImmutableList.copyOf(proxies);
        this.state = state;
        this.rounds = rounds;
    }

    public boolean isEmpty() {
        return proxies.isEmpty();
    }

    @Override
    public String toString() {
        return state + " after " + rounds + " rounds, proxies: " + proxies.size();
    }
}
