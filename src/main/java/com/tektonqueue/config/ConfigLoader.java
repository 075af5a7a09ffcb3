package com.tektonqueue.config;

import com.tektonqueue.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads and parses the policy file.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    static final String QUEUE_NAME = "queueName";
    static final String MULTI_KUEUE_OVERRIDE = "multiKueueOverride";
    static final String CEL = "cel";
    static final String EXPRESSIONS = "expressions";

    private ConfigLoader() {
    }

    /**
     * Read the raw policy document from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path file path or classpath: location
     * @return document text
     */
    public static String read(String path) {
        log.info("Reading tekton-queue configuration from: {}", path);
        Resource resource = getResource(path);
        try (InputStream inputStream = resource.getInputStream()) {
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Parse a policy document. Does not compile expressions.
     *
     * @throws ConfigurationException if the document is empty, malformed or mistyped
     */
    public static TektonQueueConfig parse(String document) {
        Object loaded;
        try {
            loaded = new Yaml().load(document);
        } catch (YAMLException e) {
            throw new ConfigurationException("Failed to parse configuration: " + e.getMessage(), e);
        }
        if (loaded == null) {
            throw new ConfigurationException("Configuration document is empty");
        }
        Map<String, Object> root = asMap(loaded, "configuration root");

        String queueName = getString(root, QUEUE_NAME);
        boolean multiKueueOverride = getBoolean(root, MULTI_KUEUE_OVERRIDE);
        CelConfig cel = parseCel(root.get(CEL));

        TektonQueueConfig config = new TektonQueueConfig(queueName, multiKueueOverride, cel);
        log.debug("Parsed configuration: queue {}, {} expressions, multiKueueOverride={}",
                queueName, cel.expressions().size(), multiKueueOverride);
        return config;
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            return new ClassPathResource(path.substring("classpath:".length()));
        }
        return new FileSystemResource(path);
    }

    private static CelConfig parseCel(Object section) {
        if (section == null) {
            return CelConfig.empty();
        }
        Map<String, Object> cel = asMap(section, CEL);
        Object rawExpressions = cel.get(EXPRESSIONS);
        if (rawExpressions == null) {
            return CelConfig.empty();
        }
        if (!(rawExpressions instanceof List<?> list)) {
            throw new ConfigurationException(
                    "'cel.expressions' must be a list, got " + typeName(rawExpressions));
        }
        List<String> expressions = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            Object item = list.get(i);
            if (!(item instanceof String expression)) {
                throw new ConfigurationException(
                        "'cel.expressions[" + i + "]' must be a string, got " + typeName(item));
            }
            expressions.add(expression);
        }
        return new CelConfig(expressions);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String what) {
        if (!(value instanceof Map)) {
            throw new ConfigurationException("'" + what + "' must be a mapping, got " + typeName(value));
        }
        return (Map<String, Object>) value;
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return null;
        if (value instanceof String s) return s;
        throw new ConfigurationException("'" + key + "' must be a string, got " + typeName(value));
    }

    private static boolean getBoolean(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        throw new ConfigurationException("'" + key + "' must be a boolean, got " + typeName(value));
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
