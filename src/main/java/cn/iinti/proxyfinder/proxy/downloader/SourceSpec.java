package cn.iinti.proxyfinder.proxy.downloader;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * 代理源定义，运行期不可变
 */
@Getter
@Builder
public class SourceSpec {
    @NonNull
    private final String name;

    /**
     * 是否支持按国家下载
     */
    private final boolean countrySupported;

    /**
     * 数值越小越优先
     */
    @Builder.Default
    private final int priority = 1;

    @NonNull
    private final SourceAdapter adapter;

    @Override
    public String toString() {
        return name;
    }
}
