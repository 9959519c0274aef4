package cn.iinti.proxyfinder.proxy.rotation;

/**
 * 一次轮换请求的状态，IDLE → FETCHING → VALIDATING → {SATISFIED | FETCHING | EXHAUSTED}
 */
public enum RotationState {
    IDLE,
    FETCHING,
    VALIDATING,
    SATISFIED,
    EXHAUSTED;

    public boolean isTerminal() {
        return this == SATISFIED || this == EXHAUSTED;
    }
}
