package cn.iinti.proxyfinder.proxy.cache;

import cn.iinti.proxyfinder.exception.ProxyFinderException;
import cn.iinti.proxyfinder.resource.ValidatedProxy;
import cn.iinti.proxyfinder.trace.Recorder;
import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONArray;
import com.alibaba.fastjson.JSONObject;
import com.alibaba.fastjson.serializer.SerializerFeature;
import com.google.common.collect.Lists;
import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 已验证代理的本地缓存，单个json文件。
 * <p>
 * save 会整体覆盖文件（不做增量合并），所有记录使用同一个写入时间；
 * load 只返回未过期的记录，损坏的记录直接跳过。
 * 同一时间只允许一个写入者，需要并发访问时由上层串行化
 */
public class ProxyCache {
    public static final String DEFAULT_CACHE_FILE = ".proxy_finder/cache/proxy_cache.json";

    private final File cacheFile;
    /**
     * 最多保存多少条记录，超过时保留最近验证的
     */
    private final int capacity;
    private final Clock clock;
    private final Recorder recorder;

    public ProxyCache(File cacheFile, int capacity, Clock clock, Recorder recorder) {
        this.cacheFile = cacheFile;
        this.capacity = capacity;
        this.clock = clock;
        this.recorder = recorder;
    }

    public static File defaultCacheFile() {
        return new File(FileUtils.getUserDirectory(), DEFAULT_CACHE_FILE);
    }

    public void save(List<ValidatedProxy> entries) {
        long now = clock.millis();
        // 同一个地址只保留最新的一次验证
        Map<String, ValidatedProxy> latest = new LinkedHashMap<>();
        for (ValidatedProxy entry : entries) {
            latest.merge(entry.getAddress(), entry,
                    (old, fresh) -> fresh.getValidatedAt() >= old.getValidatedAt() ? fresh : old);
        }
        List<ValidatedProxy> toSave = Lists.newArrayList(latest.values());
        if (capacity > 0 && toSave.size() > capacity) {
            List<ValidatedProxy> recent = toSave.stream()
                    .sorted(Comparator.comparingLong(ValidatedProxy::getValidatedAt).reversed())
                    .limit(capacity)
                    .collect(Collectors.toList());
            toSave.retainAll(recent);
        }

        JSONArray jsonArray = new JSONArray();
        for (ValidatedProxy proxy : toSave) {
            jsonArray.add(new CacheRecord(proxy, now).toJson());
        }

        try {
            File parent = cacheFile.getAbsoluteFile().getParentFile();
            FileUtils.forceMkdir(parent);
            File tmpFile = new File(parent, cacheFile.getName() + ".tmp");
            FileUtils.writeStringToFile(tmpFile,
                    JSON.toJSONString(jsonArray, SerializerFeature.PrettyFormat, SerializerFeature.WriteMapNullValue),
                    StandardCharsets.UTF_8);
            Files.move(tmpFile.toPath(), cacheFile.toPath(),
                    StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new ProxyFinderException("failed to write proxy cache: " + cacheFile.getAbsolutePath(), e);
        }
        recorder.recordEvent(() -> "saved " + toSave.size() + " proxies to cache: " + cacheFile.getAbsolutePath());
    }

    public List<ValidatedProxy> load(int maxAgeHours) {
        return loadRecords(Duration.ofHours(maxAgeHours)).stream()
                .map(CacheRecord::getProxy)
                .collect(Collectors.toList());
    }

    public List<CacheRecord> loadRecords(Duration maxAge) {
        List<CacheRecord> ret = Lists.newArrayList();
        if (!cacheFile.isFile()) {
            recorder.recordEvent(() -> "no proxy cache file exists: " + cacheFile.getAbsolutePath());
            return ret;
        }

        JSONArray jsonArray;
        try {
            jsonArray = JSON.parseArray(FileUtils.readFileToString(cacheFile, StandardCharsets.UTF_8));
        } catch (IOException | RuntimeException e) {
            recorder.recordEvent(() -> "failed to read proxy cache, treat as empty", e);
            return ret;
        }
        if (jsonArray == null) {
            return ret;
        }

        long now = clock.millis();
        long maxAgeMillis = maxAge.toMillis();
        Map<String, CacheRecord> records = new LinkedHashMap<>();
        int malformed = 0;
        for (Object item : jsonArray) {
            CacheRecord record = item instanceof JSONObject ? parseQuietly((JSONObject) item) : null;
            if (record == null) {
                malformed++;
                continue;
            }
            if (now - record.getCachedAt() > maxAgeMillis) {
                continue;
            }
            records.putIfAbsent(record.getProxy().getAddress(), record);
        }
        ret.addAll(records.values());

        int total = jsonArray.size();
        int skipped = malformed;
        recorder.recordEvent(() -> "loaded " + ret.size() + " fresh proxies from cache (out of " + total
                + " total, " + skipped + " malformed)");
        return ret;
    }

    private static CacheRecord parseQuietly(JSONObject item) {
        try {
            return CacheRecord.fromJson(item);
        } catch (RuntimeException e) {
            // 字段类型错误，如 "cachedAt":"yesterday"
            return null;
        }
    }
}
