package cn.iinti.proxyfinder.resource;

import cn.iinti.proxyfinder.exception.ConfigurationException;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nullable;

/**
 * 代理匿名等级，描述代理对源站暴露了多少原始客户端信息
 */
public enum Anonymity {
    /**
     * 透明代理，源站可以看到真实客户端ip
     */
    TRANSPARENT("transparent"),
    /**
     * 普通匿名，源站知道使用了代理，但看不到真实ip
     */
    ANONYMOUS("anonymous"),
    /**
     * 高匿，源站无法感知代理的存在
     */
    ELITE("elite"),
    UNKNOWN("unknown");

    public final String name;

    Anonymity(String name) {
        this.name = name;
    }

    /**
     * 解析代理源给出的匿名描述，各个网站的叫法五花八门，无法识别的一律视为UNKNOWN
     */
    public static Anonymity fromHint(@Nullable String hint) {
        String normalized = StringUtils.lowerCase(StringUtils.trimToEmpty(hint));
        if (normalized.isEmpty()) {
            return UNKNOWN;
        }
        if (normalized.contains("elite") || normalized.contains("high")) {
            return ELITE;
        }
        if (normalized.contains("transparent") || normalized.equals("noa")) {
            return TRANSPARENT;
        }
        if (normalized.contains("anonymous") || normalized.equals("anm")) {
            return ANONYMOUS;
        }
        return UNKNOWN;
    }

    /**
     * 解析调用方的输入，只接受确切的等级名称
     *
     * @return null if input is blank
     */
    @Nullable
    public static Anonymity fromUserInput(@Nullable String input) {
        if (StringUtils.isBlank(input)) {
            return null;
        }
        String normalized = input.trim().toLowerCase();
        for (Anonymity anonymity : values()) {
            if (anonymity != UNKNOWN && anonymity.name.equals(normalized)) {
                return anonymity;
            }
        }
        throw new ConfigurationException("unknown anonymity level: " + input
                + ", expected one of transparent/anonymous/elite");
    }

    @Override
    public String toString() {
        return name;
    }
}
