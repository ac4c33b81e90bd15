package org.netpreserve.sitewalker.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Resolves the job configuration: bundled defaults, then the job's config.yaml, then command-line overrides.
 */
public class ConfigLoader {
    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    private JsonNode tree;

    public ConfigLoader() throws ConfigException {
        try (InputStream stream = Objects.requireNonNull(ConfigLoader.class.getResourceAsStream("defaults.yaml"),
                "missing defaults.yaml")) {
            tree = mapper.readTree(stream);
        } catch (IOException e) {
            throw new ConfigException("Unable to read bundled defaults", e);
        }
    }

    public static JobConfig defaults() throws ConfigException {
        return new ConfigLoader().build();
    }

    /**
     * Defaults overlaid with the given YAML document.
     */
    public static JobConfig fromYaml(String yaml) throws ConfigException {
        return new ConfigLoader().mergeYaml(yaml).build();
    }

    public ConfigLoader mergeFile(Path configFile) throws ConfigException {
        if (!Files.exists(configFile)) return this;
        try {
            tree = deepMerge(tree, mapper.readTree(configFile.toFile()));
        } catch (IOException e) {
            throw new ConfigException("Unable to read " + configFile + ": " + e.getMessage(), e);
        }
        return this;
    }

    public ConfigLoader mergeYaml(String yaml) throws ConfigException {
        try {
            JsonNode override = mapper.readTree(yaml);
            if (override != null && !override.isMissingNode()) {
                tree = deepMerge(tree, override);
            }
        } catch (JsonProcessingException e) {
            throw new ConfigException("Unable to parse configuration: " + e.getOriginalMessage(), e);
        }
        return this;
    }

    /**
     * Overrides a single value addressed by a dotted path such as "crawl.depth".
     */
    public ConfigLoader set(String path, Object value) {
        String[] keys = path.split("\\.");
        ObjectNode node = (ObjectNode) tree;
        for (int i = 0; i < keys.length - 1; i++) {
            JsonNode child = node.get(keys[i]);
            if (child == null || !child.isObject()) {
                child = node.putObject(keys[i]);
            }
            node = (ObjectNode) child;
        }
        node.set(keys[keys.length - 1], mapper.valueToTree(value));
        return this;
    }

    public JobConfig build() throws ConfigException {
        JobConfig config;
        try {
            config = mapper.treeToValue(tree, JobConfig.class);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Invalid configuration: " + e.getOriginalMessage(), e);
        }
        return config.validate();
    }

    public String dump(JobConfig config) throws JsonProcessingException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
    }

    static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (!base.isObject() || !override.isObject()) {
            // for simple values or arrays, always take override
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            String key = entry.getKey();
            JsonNode overrideValue = entry.getValue();
            if (merged.has(key)) {
                merged.set(key, deepMerge(merged.get(key), overrideValue));
            } else {
                merged.set(key, overrideValue);
            }
        });
        return merged;
    }
}
