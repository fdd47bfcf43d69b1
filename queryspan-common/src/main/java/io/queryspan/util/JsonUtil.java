package io.queryspan.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * This class should only be used in config loading or reporting.
 */
public class JsonUtil {
    public static final ObjectMapper jsonMapper = new ObjectMapper();
    public static final ObjectMapper jsonMapperPretty = new ObjectMapper();

    static {
        jsonMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        jsonMapper.configure(SerializationFeature.INDENT_OUTPUT, false);

        jsonMapperPretty.configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    public static String toJsonPretty(Object v) {
        try {
            return jsonMapperPretty.writeValueAsString(v);
        } catch (JsonProcessingException e) {
            throw new RuntimeException(e);
        }
    }

    public static <T> T fromJson(String json, Class<T> clazz) {
        try {
            return jsonMapper.readValue(json, clazz);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    public static <T> T load(Path path, Class<T> clazz) throws IOException {
        try (InputStream in = Channels.newInputStream(FileChannel.open(path, StandardOpenOption.READ))) {
            return jsonMapper.readValue(in, clazz);
        }
    }
}
