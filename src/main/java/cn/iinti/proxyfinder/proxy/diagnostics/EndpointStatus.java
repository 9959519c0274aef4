package cn.iinti.proxyfinder.proxy.diagnostics;

import lombok.Getter;
import lombok.ToString;

import javax.annotation.Nullable;

/**
 * 一个地址的直连检查结果
 */
@Getter
@ToString
public class EndpointStatus {
    public static final int NO_RESPONSE = -1;

    private final String url;
    private final boolean working;
    private final int statusCode;

    /**
     * 收到响应的耗时，单位秒，没有响应时为空
     */
    @Nullable
    private final Double responseSeconds;

    @Nullable
    private final String error;

    private EndpointStatus(String url, boolean working, int statusCode,
                           @Nullable Double responseSeconds, @Nullable String error) {
        this.url = url;
        this.working = working;
        this.statusCode = statusCode;
        this.responseSeconds = responseSeconds;
        this.error = error;
    }

    public static EndpointStatus responded(String url, int statusCode, double responseSeconds) {
        boolean working = statusCode >= 200 && statusCode < 300;
        return new EndpointStatus(url, working, statusCode, responseSeconds,
                working ? null : "http status " + statusCode);
    }

    public static EndpointStatus failed(String url, String error) {
        return new EndpointStatus(url, false, NO_RESPONSE, null, error);
    }
}
