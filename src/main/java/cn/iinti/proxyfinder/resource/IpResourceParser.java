package cn.iinti.proxyfinder.resource;

import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONArray;
import com.alibaba.fastjson.JSONObject;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 代理源响应内容解析，解析结果只做字段提取，格式合法性由过滤器统一检查
 */
public interface IpResourceParser {
    List<CandidateProxy> parse(String responseText);

    public static IpResourceParser resolve(String format) {
        return "json".equalsIgnoreCase(format) ?
                JSONParser.instance : SmartParser.instance;
    }

    /**
     * 支持两种结构：对象数组，或者 {"data":[...]} 包装（geonode一类的接口）
     */
    class JSONParser implements IpResourceParser {

        public static JSONParser instance = new JSONParser();

        @Override
        public List<CandidateProxy> parse(String responseText) {
            responseText = StringUtils.trimToEmpty(responseText);
            JSONArray items;
            if (responseText.startsWith("[")) {
                items = JSON.parseArray(responseText);
            } else if (responseText.startsWith("{")) {
                JSONObject jsonObject = JSON.parseObject(responseText);
                items = jsonObject.getJSONArray("data");
                if (items == null) {
                    items = new JSONArray();
                    items.add(jsonObject);
                }
            } else {
                return Collections.emptyList();
            }

            List<CandidateProxy> ret = new ArrayList<>(items.size());
            for (int i = 0; i < items.size(); i++) {
                Object item = items.get(i);
                if (!(item instanceof JSONObject)) {
                    continue;
                }
                CandidateProxy candidate = fromJson((JSONObject) item);
                if (candidate != null) {
                    ret.add(candidate);
                }
            }
            return ret;
        }

        private static CandidateProxy fromJson(JSONObject item) {
            String ip = firstNonBlank(item, "ip", "proxyHost", "host");
            String port = firstNonBlank(item, "port", "proxyPort");
            if (ip == null || port == null) {
                return null;
            }
            CandidateProxy candidate = new CandidateProxy(ip.trim() + ":" + port.trim());
            String country = firstNonBlank(item, "country_code", "countryCode", "country");
            if (country != null && country.trim().length() == 2) {
                candidate.setCountryHint(country.trim().toUpperCase());
            }
            candidate.setAnonymityHint(Anonymity.fromHint(firstNonBlank(item, "anonymity", "anonymityLevel")));
            return candidate;
        }

        private static String firstNonBlank(JSONObject item, String... keys) {
            for (String key : keys) {
                String value = item.getString(key);
                if (StringUtils.isNotBlank(value)) {
                    return value;
                }
            }
            return null;
        }
    }
}
