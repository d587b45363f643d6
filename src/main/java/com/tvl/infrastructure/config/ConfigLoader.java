package com.tvl.infrastructure.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Loads application.yml from the classpath into a JsonObject
 */
@Slf4j
public final class ConfigLoader {

    public static final String DEFAULT_RESOURCE = "application.yml";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> CONFIG_TREE = new TypeReference<>() {
    };

    private ConfigLoader() {
    }

    public static JsonObject load() {
        return load(DEFAULT_RESOURCE);
    }

    public static JsonObject load(String resource) {
        try (InputStream is = ConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException(resource + " not found in classpath");
            }
            Map<String, Object> tree = YAML.readValue(is, CONFIG_TREE);
            JsonObject config = tree == null ? new JsonObject() : new JsonObject(tree);
            log.info("Loaded configuration from {}", resource);
            return config;
        } catch (IOException e) {
            log.error("Failed to read {}: {}", resource, e.getMessage());
            throw new IllegalStateException("Configuration error: " + resource + " is unreadable", e);
        }
    }
}
