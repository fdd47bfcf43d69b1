package io.queryspan.util;

import org.apache.commons.lang.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Properties;

public class PropertiesUtils {

    public static int getInt(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(key);
        return StringUtils.isBlank(value) ? defaultValue : Integer.parseInt(value.trim());
    }

    public static String getString(Properties properties, String key, String defaultValue) {
        String value = properties.getProperty(key);
        return StringUtils.isBlank(value) ? defaultValue : value.trim();
    }

    /**
     * Load a classpath resource, returns an empty {@link Properties} if the resource does not exist.
     */
    public static Properties loadRs(String s) throws IOException {
        Properties p = new Properties();
        try (InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(s)) {
            if (in != null) {
                p.load(in);
            }
        }
        return p;
    }

    public static Properties load(Path path) throws IOException {
        Properties p = new Properties();
        try (InputStream in = Channels.newInputStream(FileChannel.open(path, StandardOpenOption.READ))) {
            p.load(in);
        }
        return p;
    }
}
