package cn.iinti.proxyfinder.proxy.filter;

import cn.iinti.proxyfinder.resource.CandidateProxy;
import cn.iinti.proxyfinder.utils.IpUtils;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Map;

/**
 * 根据ip前缀粗略猜测国家。
 * <p>
 * 这只是一张静态的经验表，没有任何准确性保证（大量网段早已转手），
 * 只在代理源没有提供国家信息、而调用方又指定了国家时作为最后手段使用。
 * 返回值只保证是一个ISO国家代码或者 {@link CandidateProxy#UNKNOWN_COUNTRY}
 */
public class CountryHeuristic {

    /**
     * key 为 "a" 或者 "a.b" 形式的前缀，两段前缀优先匹配
     */
    private static final Map<String, String> prefixTable = buildPrefixTable();

    private static final Splitter dotSplitter = Splitter.on('.');

    private static Map<String, String> buildPrefixTable() {
        ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
        builder.put("104.16", "US").put("104.17", "US");
        for (String first : new String[]{"144", "146", "147", "148", "149", "152", "153", "154", "155", "156",
                "165", "166", "167", "168", "169", "170", "171", "172", "173", "174", "192", "198", "199",
                "204", "205", "206", "207", "208", "209", "216", "63", "64", "65", "66", "67", "68", "69",
                "70", "71", "72", "73", "74", "75", "76", "96", "97", "98", "99"}) {
            builder.put(first, "US");
        }
        putAll(builder, "DE", "5", "46");
        putAll(builder, "RU", "185", "95");
        putAll(builder, "IN", "103");
        putAll(builder, "CN", "1", "116", "118", "121", "122", "123", "124", "125", "222", "223", "58", "59", "60", "61");
        putAll(builder, "KR", "14", "111", "112", "211");
        putAll(builder, "SG", "119", "175", "202");
        putAll(builder, "FR", "195");
        putAll(builder, "NL", "91");
        putAll(builder, "MX", "200", "201");
        putAll(builder, "BR", "45", "187", "189");
        putAll(builder, "GB", "213");
        putAll(builder, "JP", "139");
        putAll(builder, "AU", "203");
        return builder.build();
    }

    private static void putAll(ImmutableMap.Builder<String, String> builder, String country, String... prefixes) {
        for (String prefix : prefixes) {
            builder.put(prefix, country);
        }
    }

    /**
     * @param address ip 或者 ip:port
     */
    public static String guess(String address) {
        String ip = StringUtils.substringBefore(StringUtils.trimToEmpty(address), ":");
        if (!IpUtils.isIpV4(ip)) {
            return CandidateProxy.UNKNOWN_COUNTRY;
        }
        List<String> segments = dotSplitter.splitToList(ip);
        String country = prefixTable.get(segments.get(0) + "." + segments.get(1));
        if (country == null) {
            country = prefixTable.get(segments.get(0));
        }
        return country == null ? CandidateProxy.UNKNOWN_COUNTRY : country;
    }
}
