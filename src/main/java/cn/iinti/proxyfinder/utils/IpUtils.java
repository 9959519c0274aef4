package cn.iinti.proxyfinder.utils;

import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONObject;
import com.google.common.base.Splitter;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nullable;
import java.util.List;

public class IpUtils {

    private static final Splitter dotSplitter = Splitter.on('.');

    public static boolean isIpV4(String input) {
        if (StringUtils.isBlank(input)) {
            return false;
        }
        // 3 * 4 + 3 = 15
        // 1 * 4 + 3 = 7
        if (input.length() > 15 || input.length() < 7) {
            return false;
        }

        List<String> split = dotSplitter.splitToList(input);
        if (split.size() != 4) {
            return false;
        }
        for (String segment : split) {
            // isNumeric 排除了 "+1"、" 1" 这一类 parseInt 可以接受的写法
            if (segment.isEmpty() || segment.length() > 3 || !StringUtils.isNumeric(segment)) {
                return false;
            }
            int i = Integer.parseInt(segment);
            if (i > 255) {
                return false;
            }
        }
        return true;
    }

    /**
     * 从回显接口的响应中提取出口ip，支持纯文本ip，以及httpbin(origin)、ip-api(query)的json格式
     */
    @Nullable
    public static String extractExitIp(@Nullable String responseBody) {
        String body = StringUtils.trimToEmpty(responseBody);
        if (isIpV4(body)) {
            return body;
        }
        if (!body.startsWith("{")) {
            return null;
        }
        try {
            JSONObject jsonObject = JSON.parseObject(body);
            for (String key : new String[]{"origin", "query", "ip"}) {
                String value = StringUtils.trimToEmpty(jsonObject.getString(key));
                // httpbin 在经过多层代理时会返回 "a, b"
                value = StringUtils.substringBefore(value, ",").trim();
                if (isIpV4(value)) {
                    return value;
                }
            }
        } catch (RuntimeException e) {
            // not a json object, the endpoint answered with a page
            return null;
        }
        return null;
    }
}
