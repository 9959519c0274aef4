package cn.iinti.proxyfinder.exception;

import lombok.Getter;

/**
 * 重试预算耗尽，且一个可用代理都没有找到
 */
public class ExhaustionException extends ProxyFinderException {
    @Getter
    private final int rounds;

    public ExhaustionException(String message, int rounds) {
        super(message);
        this.rounds = rounds;
    }
}
