package cn.iinti.proxyfinder.utils;

import com.alibaba.fastjson.parser.ParserConfig;
import com.alibaba.fastjson.util.TypeUtils;
import com.google.common.base.Splitter;
import lombok.SneakyThrows;
import org.apache.commons.lang3.StringUtils;
import org.ini4j.ConfigParser;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.List;
import java.util.function.Consumer;

/**
 * ini配置段的类型化访问，每个配置项声明为一个ConfigValue字段，构造时即完成读取和类型转换
 */
public abstract class IniConfig {
    private final ConfigParser config;
    protected final String section;

    public IniConfig(ConfigParser config, String section) {
        this.config = config;
        this.section = section;
    }

    @SneakyThrows
    protected void acceptConfig(String key, Consumer<String> consumer) {
        if (config.hasSection(section) && config.hasOption(section, key)) {
            consumer.accept(config.get(section, key));
        }
    }

    public abstract class ConfigValue<V> {
        public final V value;
        public final String key;

        public ConfigValue(String key, V defaultValue) {
            this.key = key;
            this.value = calcValue(key, defaultValue);
        }

        @SneakyThrows
        private V calcValue(String key, V defaultValue) {
            key = key.toLowerCase();
            if (config.hasSection(section) && config.hasOption(section, key)) {
                String config = IniConfig.this.config.get(section, key);
                if (StringUtils.isNotBlank(config)) {
                    return convert(config.trim());
                }
            }
            return defaultValue;
        }

        protected V convert(String config) {
            Class<V> superClassGenericType = getSuperClassGenericType(getClass());
            return TypeUtils.cast(config, superClassGenericType, ParserConfig.getGlobalInstance());
        }

        @SuppressWarnings("unchecked")
        private <T> Class<T> getSuperClassGenericType(Class<?> clazz) {
            Type genType = clazz.getGenericSuperclass();
            if (!(genType instanceof ParameterizedType)) {
                return (Class<T>) Object.class;
            }
            Type[] params = ((ParameterizedType) genType).getActualTypeArguments();
            if (0 == params.length) {
                return (Class<T>) Object.class;
            } else if (!(params[0] instanceof Class)) {
                return (Class<T>) Object.class;
            } else {
                return (Class<T>) params[0];
            }
        }
    }


    public class StringConfigValue extends ConfigValue<String> {
        public StringConfigValue(String configKey, String defaultValue) {
            super(configKey, defaultValue);
        }
    }

    public class BooleanConfigValue extends ConfigValue<Boolean> {
        public BooleanConfigValue(String configKey, Boolean defaultValue) {
            super(configKey, defaultValue);
        }
    }

    public class IntegerConfigValue extends ConfigValue<Integer> {
        public IntegerConfigValue(String configKey, Integer defaultValue) {
            super(configKey, defaultValue);
        }
    }

    public class DoubleConfigValue extends ConfigValue<Double> {
        public DoubleConfigValue(String configKey, Double defaultValue) {
            super(configKey, defaultValue);
        }
    }

    private static final Splitter listSplitter = Splitter.on(',').omitEmptyStrings().trimResults();

    /**
     * 逗号分隔的列表
     */
    public class ListConfigValue extends ConfigValue<List<String>> {
        public ListConfigValue(String configKey, List<String> defaultValue) {
            super(configKey, defaultValue);
        }

        @Override
        protected List<String> convert(String config) {
            return listSplitter.splitToList(config);
        }
    }
}
