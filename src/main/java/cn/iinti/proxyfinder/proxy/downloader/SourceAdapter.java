package cn.iinti.proxyfinder.proxy.downloader;

import cn.iinti.proxyfinder.exception.SourceUnavailableException;
import cn.iinti.proxyfinder.resource.CandidateProxy;

import javax.annotation.Nullable;
import java.util.List;

/**
 * 单个代理源的下载+解析能力。实现必须在timeoutMillis内返回，超时或失败时抛出SourceUnavailableException
 */
@FunctionalInterface
public interface SourceAdapter {
    /**
     * @param country 目标国家，为空表示不限制；不支持国家过滤的代理源可以忽略
     */
    List<CandidateProxy> fetch(SourceSpec spec, @Nullable String country, int timeoutMillis)
            throws SourceUnavailableException;
}
