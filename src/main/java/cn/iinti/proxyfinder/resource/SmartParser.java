package cn.iinti.proxyfinder.resource;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.Lists;
import org.apache.commons.lang3.StringUtils;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * 通用文本格式解析器，同时支持一行一个ip:port，以及端口段（proxy.example.com:8000-8010）
 */
public class SmartParser implements IpResourceParser {

    public static SmartParser instance = new SmartParser();

    /**
     * 端口段展开的上限，避免配置错误时生成海量候选
     */
    private static final int MAX_PORT_SPACE = 1024;

    private static final Splitter smartSplitter = Splitter.on(CharMatcher.anyOf("\r\n,")).omitEmptyStrings().trimResults();
    private static final Splitter portSplitter = Splitter.on(':').omitEmptyStrings().trimResults();

    @Override
    public List<CandidateProxy> parse(String responseText) {
        LinkedHashSet<String> addresses = new LinkedHashSet<>();
        smartSplitter.split(StringUtils.defaultString(responseText))
                .forEach(pair -> {
                    if (pair.startsWith("#")) {
                        return;
                    }
                    List<String> ipAndPortSpace = portSplitter.splitToList(pair);
                    if (ipAndPortSpace.size() != 2) {
                        // 交给过滤器丢弃，这里不做判断
                        addresses.add(pair);
                        return;
                    }
                    String ip = ipAndPortSpace.get(0);
                    String portSpace = ipAndPortSpace.get(1);
                    if (portSpace.contains("-")) {
                        fillSpace(ip, portSpace, addresses);
                    } else {
                        addresses.add(ip + ":" + portSpace);
                    }
                });
        List<CandidateProxy> ret = Lists.newArrayListWithCapacity(addresses.size());
        for (String address : addresses) {
            ret.add(new CandidateProxy(address));
        }
        return ret;
    }

    private static void fillSpace(String ip, String portSpace, LinkedHashSet<String> addresses) {
        int index = portSpace.indexOf("-");
        String startStr = portSpace.substring(0, index).trim();
        String endStr = portSpace.substring(index + 1).trim();
        if (!StringUtils.isNumeric(startStr) || !StringUtils.isNumeric(endStr)
                || startStr.length() > 5 || endStr.length() > 5) {
            return;
        }
        int start = Integer.parseInt(startStr);
        int end = Math.min(Integer.parseInt(endStr), start + MAX_PORT_SPACE - 1);
        for (int i = start; i <= end; i++) {
            addresses.add(ip + ":" + i);
        }
    }

    private SmartParser() {
    }
}
