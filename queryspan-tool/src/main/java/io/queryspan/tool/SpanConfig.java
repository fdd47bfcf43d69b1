package io.queryspan.tool;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

import javax.annotation.Nullable;

import io.queryspan.span.explore.ExplorationMode;
import io.queryspan.util.PropertiesUtils;

/**
 * Settings of the span tool. Loaded from the classpath resource {@value #CONFIG_RESOURCE}, then
 * an optional config file, then system properties starting with "queryspan.", later ones win.
 */
public class SpanConfig {
    private static final Logger log = LoggerFactory.getLogger(SpanConfig.class);

    public static final String CONFIG_RESOURCE = "queryspan.config.properties";
    public static final String PREFIX = "queryspan.";

    public static final String EXPLAIN_THREADS = "queryspan.explain.threads";
    public static final String EXPLORE_MODE = "queryspan.explore.mode";
    public static final String CONNECTOR_CONFIG = "queryspan.connector.config";
    public static final String STORAGE_URL = "queryspan.storage.url";
    public static final String STORAGE_USER = "queryspan.storage.user";
    public static final String STORAGE_PASSWORD = "queryspan.storage.password";

    public static final int DEFAULT_EXPLAIN_THREADS = 4;

    private final Properties properties;

    public SpanConfig(Properties properties) {
        this.properties = properties;
    }

    public static SpanConfig load(@Nullable Path configFile) throws IOException {
        Properties config = PropertiesUtils.loadRs(CONFIG_RESOURCE);
        if (configFile != null) {
            config.putAll(PropertiesUtils.load(configFile));
        }
        for (Map.Entry<Object, Object> e : System.getProperties().entrySet()) {
            if (e.getKey().toString().startsWith(PREFIX)) {
                config.put(e.getKey(), e.getValue());
            }
        }
        SpanConfig spanConfig = new SpanConfig(config);
        spanConfig.logSettings();
        return spanConfig;
    }

    private void logSettings() {
        Map<String, String> sorted = new TreeMap<>();
        properties.forEach((k, v) -> sorted.put(k.toString(), v.toString()));
        sorted.forEach((key, value) -> {
            if (key.startsWith(PREFIX)) {
                log.info("{} = {}", key, key.endsWith("password") ? "******" : value);
            }
        });
    }

    public void set(String key, String value) {
        properties.setProperty(key, value);
    }

    public int explainThreads() {
        int threads = PropertiesUtils.getInt(properties, EXPLAIN_THREADS, DEFAULT_EXPLAIN_THREADS);
        Preconditions.checkArgument(threads > 0, "%s should be positive, got %s", EXPLAIN_THREADS, threads);
        return threads;
    }

    public ExplorationMode exploreMode() {
        return ExplorationMode.parse(PropertiesUtils.getString(properties, EXPLORE_MODE, ExplorationMode.NONE.name()));
    }

    public Path connectorConfig() {
        return Paths.get(mustGet(CONNECTOR_CONFIG));
    }

    public String storageUrl() {
        return mustGet(STORAGE_URL);
    }

    public String storageUser() {
        return PropertiesUtils.getString(properties, STORAGE_USER, "");
    }

    public String storagePassword() {
        return PropertiesUtils.getString(properties, STORAGE_PASSWORD, "");
    }

    private String mustGet(String key) {
        String value = PropertiesUtils.getString(properties, key, null);
        Preconditions.checkState(value != null, "please specify %s", key);
        return value;
    }
}
