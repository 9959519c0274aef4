package cn.iinti.proxyfinder.utils;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.InputStream;

public class ResourceUtil {

    public static InputStream openResource(String name) {
        InputStream resource = ResourceUtil.class.getClassLoader()
                .getResourceAsStream(name);
        if (resource == null) {
            throw new IllegalStateException("can not find resource: " + name);
        }
        return resource;
    }

    /**
     * 优先使用文件系统上的配置文件，不存在时回退到classpath
     */
    public static InputStream openConfig(String name) {
        File file = new File(name);
        if (file.isFile()) {
            try {
                return new FileInputStream(file);
            } catch (FileNotFoundException e) {
                throw new IllegalStateException("can not open config file: " + file.getAbsolutePath(), e);
            }
        }
        return openResource(name);
    }
}
