package cn.iinti.proxyfinder;

import cn.iinti.proxyfinder.exception.ConfigurationException;
import cn.iinti.proxyfinder.utils.IniConfig;
import cn.iinti.proxyfinder.utils.ResourceUtil;
import com.google.common.collect.Lists;
import lombok.Getter;
import org.ini4j.ConfigParser;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * 配置文件解析和配置内容定义
 */
public class Settings {

    public static final String DEFAULT_CONFIG = "config.ini";

    /**
     * 全局配置
     */
    @Getter
    private final Global global;
    /**
     * 代理源定义，每个 [source:xxx] 段对应一个
     */
    @Getter
    private final List<IpSource> ipSourceList = new ArrayList<>();

    private Settings(ConfigParser config) {
        global = new Global(config);
        for (String sectionName : config.sections()) {
            if (sectionName.startsWith("source:")) {
                ipSourceList.add(new IpSource(config, sectionName));
            }
        }
    }

    public static Settings load() {
        return load(DEFAULT_CONFIG);
    }

    public static Settings load(String configName) {
        try (InputStream stream = ResourceUtil.openConfig(configName)) {
            return load(stream);
        } catch (IOException | IllegalStateException e) {
            throw new ConfigurationException("failed to read config: " + configName, e);
        }
    }

    public static Settings load(InputStream stream) {
        ConfigParser config = new ConfigParser();
        try {
            config.read(stream);
        } catch (Exception e) {
            throw new ConfigurationException("failed to parse ini config", e);
        }
        return new Settings(config);
    }

    @Getter
    public static class IpSource extends IniConfig {

        public IpSource(ConfigParser config, String section) {
            super(config, section);
            name = section.substring("source:".length());
        }

        public final String name;

        /**
         * 下载地址，{country} 占位符会被替换为目标国家代码
         */
        public final StringConfigValue loadURL = new StringConfigValue(
                "loadURL", "");

        /**
         * 资源格式，目前支持两种
         * plain：文本分割，如 1.2.3.4:8080,5.6.7.8:3128 或者一行一个
         * json: json数组，或者 {"data":[...]} 包装，元素包含 ip/port/country_code/anonymity
         */
        public final StringConfigValue resourceFormat = new StringConfigValue(
                "resourceFormat", "plain"
        );

        public final BooleanConfigValue enable = new BooleanConfigValue(
                "enable", true
        );

        /**
         * 该代理源是否支持按国家下载
         */
        public final BooleanConfigValue countrySupported = new BooleanConfigValue(
                "countrySupported", false
        );

        /**
         * 数值越小越优先
         */
        public final IntegerConfigValue priority = new IntegerConfigValue(
                "priority", 1
        );

        /**
         * 不指定国家时 {country} 占位符的替换值
         */
        public final StringConfigValue countryWildcard = new StringConfigValue(
                "countryWildcard", ""
        );

    }

    @Getter
    public static class Global extends IniConfig {

        public final BooleanConfigValue debug = new BooleanConfigValue(
                "debug", false
        );

        /**
         * 功能探测使用的回显接口，按顺序尝试，第一个成功即停止
         */
        public final ListConfigValue echoURLs = new ListConfigValue(
                "echoURLs", Lists.newArrayList(
                "http://httpbin.org/ip",
                "http://ip-api.com/json",
                "http://ifconfig.me/ip",
                "http://www.google.com",
                "http://example.com"
        ));

        /**
         * 诊断时用来判断本机是否能上网的地址，任意一个可达即认为网络正常
         */
        public final ListConfigValue connectivityURLs = new ListConfigValue(
                "connectivityURLs", Lists.newArrayList(
                "https://www.google.com",
                "https://1.1.1.1"
        ));

        /**
         * 连通性检查（tcp connect）超时
         */
        public final IntegerConfigValue connectTimeout = new IntegerConfigValue(
                "connectTimeout", 5_000
        );

        /**
         * 单次功能探测超时
         */
        public final IntegerConfigValue probeTimeout = new IntegerConfigValue(
                "probeTimeout", 10_000
        );

        /**
         * 功能探测全部失败时，只要tcp可达仍然返回（状态为unvalidated）
         */
        public final BooleanConfigValue lenientValidation = new BooleanConfigValue(
                "lenientValidation", true
        );

        public final IntegerConfigValue validateConcurrency = new IntegerConfigValue(
                "validateConcurrency", 10
        );

        public final IntegerConfigValue sourceTimeout = new IntegerConfigValue(
                "sourceTimeout", 10_000
        );

        /**
         * 一轮下载的整体截止时间
         */
        public final IntegerConfigValue fetchDeadline = new IntegerConfigValue(
                "fetchDeadline", 30_000
        );

        /**
         * 一轮探测的整体截止时间
         */
        public final IntegerConfigValue validateDeadline = new IntegerConfigValue(
                "validateDeadline", 60_000
        );

        public final IntegerConfigValue maxSources = new IntegerConfigValue(
                "maxSources", 8
        );

        public final IntegerConfigValue maxCandidates = new IntegerConfigValue(
                "maxCandidates", 100
        );

        public final IntegerConfigValue maxRetries = new IntegerConfigValue(
                "maxRetries", 3
        );

        public final IntegerConfigValue maxAttemptsPerProxy = new IntegerConfigValue(
                "maxAttemptsPerProxy", 10
        );

        /**
         * 预算进入最后这个比例时，重新抽样已经见过的候选
         */
        public final DoubleConfigValue finalStretchRatio = new DoubleConfigValue(
                "finalStretchRatio", 0.2
        );

        public final IntegerConfigValue retrySampleSize = new IntegerConfigValue(
                "retrySampleSize", 10
        );

        public final BooleanConfigValue useCache = new BooleanConfigValue(
                "useCache", true
        );

        /**
         * 为空时使用 ~/.proxy_finder/cache/proxy_cache.json
         */
        public final StringConfigValue cacheFile = new StringConfigValue(
                "cacheFile", ""
        );

        public final IntegerConfigValue cacheMaxAgeHours = new IntegerConfigValue(
                "cacheMaxAgeHours", 24
        );

        public final IntegerConfigValue cacheCapacity = new IntegerConfigValue(
                "cacheCapacity", 200
        );

        public Global(ConfigParser config) {
            super(config, "global");
        }
    }
}
