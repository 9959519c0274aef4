package cn.iinti.proxyfinder.proxy.cache;

import cn.iinti.proxyfinder.resource.Anonymity;
import cn.iinti.proxyfinder.resource.CandidateProxy;
import cn.iinti.proxyfinder.resource.IpAndPort;
import cn.iinti.proxyfinder.resource.ValidatedProxy;
import cn.iinti.proxyfinder.resource.ValidationStatus;
import com.alibaba.fastjson.JSONObject;
import lombok.Getter;
import org.apache.commons.lang3.EnumUtils;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nullable;

/**
 * 缓存文件中的一条记录：ValidatedProxy + 写入缓存的时间
 */
@Getter
public class CacheRecord {
    private final ValidatedProxy proxy;
    private final long cachedAt;

    public CacheRecord(ValidatedProxy proxy, long cachedAt) {
        this.proxy = proxy;
        this.cachedAt = cachedAt;
    }

    public JSONObject toJson() {
        JSONObject jsonObject = new JSONObject(true);
        jsonObject.put("address", proxy.getAddress());
        jsonObject.put("country", proxy.getCountry());
        jsonObject.put("anonymity", proxy.getAnonymity().name());
        jsonObject.put("anonymityInferred", proxy.isAnonymityInferred());
        jsonObject.put("latencySeconds", proxy.getLatencySeconds());
        jsonObject.put("requiresAuth", proxy.isRequiresAuth());
        jsonObject.put("status", proxy.getStatus().name());
        jsonObject.put("validatedAt", proxy.getValidatedAt());
        jsonObject.put("cachedAt", cachedAt);
        jsonObject.put("exitIp", proxy.getExitIp());
        jsonObject.put("sourceName", proxy.getSourceName());
        return jsonObject;
    }

    /**
     * 解析一条缓存记录，任何必需字段缺失或者非法都返回null，由调用方跳过
     */
    @Nullable
    public static CacheRecord fromJson(JSONObject jsonObject) {
        String address = jsonObject.getString("address");
        if (IpAndPort.parse(address) == null) {
            return null;
        }
        Long cachedAt = jsonObject.getLong("cachedAt");
        Double latency = jsonObject.getDouble("latencySeconds");
        if (cachedAt == null || latency == null || latency < 0 || latency.isNaN()) {
            return null;
        }
        Anonymity anonymity = EnumUtils.getEnumIgnoreCase(Anonymity.class,
                jsonObject.getString("anonymity"), Anonymity.UNKNOWN);
        ValidationStatus status = EnumUtils.getEnumIgnoreCase(ValidationStatus.class,
                jsonObject.getString("status"), ValidationStatus.VALID);
        Long validatedAt = jsonObject.getLong("validatedAt");
        Boolean requiresAuth = jsonObject.getBoolean("requiresAuth");
        // 没有来源标记的记录按推断值处理
        Boolean anonymityInferred = jsonObject.getBoolean("anonymityInferred");

        ValidatedProxy proxy = ValidatedProxy.builder()
                .address(address)
                .country(StringUtils.defaultIfBlank(jsonObject.getString("country"), CandidateProxy.UNKNOWN_COUNTRY))
                .anonymity(anonymity)
                .anonymityInferred(anonymityInferred == null || anonymityInferred)
                .latencySeconds(latency)
                .requiresAuth(requiresAuth != null && requiresAuth)
                .status(status)
                .validatedAt(validatedAt == null ? cachedAt : validatedAt)
                .exitIp(jsonObject.getString("exitIp"))
                .sourceName(jsonObject.getString("sourceName"))
                .build();
        return new CacheRecord(proxy, cachedAt);
    }
}
