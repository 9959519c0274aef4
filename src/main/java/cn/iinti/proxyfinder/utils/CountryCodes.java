package cn.iinti.proxyfinder.utils;

import cn.iinti.proxyfinder.exception.ConfigurationException;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * ISO 3166 两位国家代码校验
 */
public class CountryCodes {
    private static final Set<String> isoCountries = ImmutableSet.copyOf(Arrays.asList(Locale.getISOCountries()));

    public static boolean isIsoCountry(@Nullable String code) {
        return code != null && isoCountries.contains(code.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * 规范化调用方传入的国家列表：去空白、转大写、去重，任意一个非法代码都直接拒绝
     *
     * @return empty list if no country restriction
     */
    public static List<String> normalize(@Nullable Collection<String> countries) {
        if (countries == null || countries.isEmpty()) {
            return Lists.newArrayList();
        }
        LinkedHashSet<String> ret = new LinkedHashSet<>();
        for (String country : countries) {
            if (StringUtils.isBlank(country)) {
                continue;
            }
            String code = country.trim().toUpperCase(Locale.ROOT);
            if (!isoCountries.contains(code)) {
                throw new ConfigurationException("unrecognized country code: " + country);
            }
            ret.add(code);
        }
        return Lists.newArrayList(ret);
    }
}
