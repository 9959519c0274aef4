package cn.iinti.proxyfinder.exception;

import lombok.Getter;

/**
 * 单个代理源不可用（网络失败、响应为空、解析失败），只在抓取器内部消化，不会抛给调用方
 */
public class SourceUnavailableException extends ProxyFinderException {
    @Getter
    private final String sourceName;

    public SourceUnavailableException(String sourceName, String message) {
        super(sourceName + ": " + message);
        this.sourceName = sourceName;
    }

    public SourceUnavailableException(String sourceName, String message, Throwable cause) {
        super(sourceName + ": " + message, cause);
        this.sourceName = sourceName;
    }
}
