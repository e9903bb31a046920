package com.autorestart.common.config;

import com.autorestart.common.infra.JsonFile;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Plugin configuration kept in a single JSON file.
 * <p>
 * Reads go through a short-lived cache. String values may reference the
 * environment as {@code ${VAR}} or {@code ${VAR:-default}}. Updates touch only
 * the keys they name, so the rest of the document, including keys this plugin
 * does not model, is written back as it was found.
 */
@Slf4j
public class ConfigService implements ConfigStore {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_REF = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");
    private static final TypeReference<LinkedHashMap<String, Object>> RAW_MAP = new TypeReference<>() {
    };

    private final Path file;
    private final Map<String, String> env;
    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final Cache<Path, PluginConfig> cache;

    public ConfigService(Path file) {
        this(file, DEFAULT_CACHE_TTL, System.getenv());
    }

    public ConfigService(Path file, Duration cacheTtl, Map<String, String> env) {
        this.file = expandHome(file);
        this.env = env;
        this.cache = Caffeine.newBuilder()
                .maximumSize(1)
                .expireAfterWrite(cacheTtl)
                .build();
    }

    @Override
    public PluginConfig load() {
        return cache.get(file, this::readFromDisk);
    }

    /**
     * Drop the cached copy and read the file again.
     */
    public PluginConfig reload() {
        cache.invalidate(file);
        return load();
    }

    /**
     * A file that exists but does not hold a JSON object is never replaced;
     * the update fails instead. A {@code ${VAR}} reference already in the file
     * is kept while it still resolves to the value being written, so secrets
     * held in the environment stay there.
     */
    @Override
    public synchronized void update(Map<String, ?> changes) throws IOException {
        Map<String, Object> document = readDocument();
        changes.forEach((key, value) -> {
            if (value == null) {
                document.remove(key);
            } else {
                document.put(key, merge(document.get(key), mapper.convertValue(value, Object.class)));
            }
        });
        JsonFile.writeAtomically(file, document);
        cache.invalidate(file);
        log.debug("Updated {} in {}", changes.keySet(), file);
    }

    @SuppressWarnings("unchecked")
    private Object merge(Object existing, Object incoming) {
        if (existing instanceof Map && incoming instanceof Map) {
            Map<String, Object> merged = new LinkedHashMap<>((Map<String, Object>) existing);
            ((Map<String, Object>) incoming).forEach((key, value) -> {
                if (value != null) {
                    merged.put(key, merge(merged.get(key), value));
                }
            });
            return merged;
        }
        return isUnchangedEnvRef(existing, incoming) ? existing : incoming;
    }

    private boolean isUnchangedEnvRef(Object existing, Object value) {
        return existing instanceof String raw
                && raw.contains("${")
                && substituteEnvVars(raw).equals(String.valueOf(value));
    }

    private Map<String, Object> readDocument() throws IOException {
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        String text = Files.readString(file);
        if (text.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return mapper.readValue(text, RAW_MAP);
        } catch (JsonProcessingException e) {
            throw new IOException("Config " + file + " is not a readable JSON object, refusing to overwrite it", e);
        }
    }

    private PluginConfig readFromDisk(Path path) {
        if (!Files.exists(path)) {
            log.warn("No config at {}, using defaults", path);
            return ConfigDefaults.apply(new PluginConfig());
        }
        try {
            String text = Files.readString(path);
            PluginConfig config = text.isBlank()
                    ? null
                    : mapper.treeToValue(resolveEnvRefs(mapper.readTree(text)), PluginConfig.class);
            log.debug("Read config from {}", path);
            return ConfigDefaults.apply(config == null ? new PluginConfig() : config);
        } catch (IOException e) {
            log.error("Config at {} could not be read, using defaults", path, e);
            return ConfigDefaults.apply(new PluginConfig());
        }
    }

    private JsonNode resolveEnvRefs(JsonNode node) {
        if (node.isTextual()) {
            return TextNode.valueOf(substituteEnvVars(node.asText()));
        }
        if (node instanceof ObjectNode object) {
            List<String> names = new ArrayList<>();
            object.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                object.set(name, resolveEnvRefs(object.get(name)));
            }
        } else if (node instanceof ArrayNode array) {
            for (int i = 0; i < array.size(); i++) {
                array.set(i, resolveEnvRefs(array.get(i)));
            }
        }
        return node;
    }

    String substituteEnvVars(String text) {
        Matcher m = ENV_REF.matcher(text);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String fallback = m.group(2) == null ? "" : m.group(2);
            m.appendReplacement(out, Matcher.quoteReplacement(env.getOrDefault(m.group(1), fallback)));
        }
        m.appendTail(out);
        return out.toString();
    }

    private static Path expandHome(Path path) {
        String s = path.toString();
        return s.startsWith("~") ? Path.of(System.getProperty("user.home") + s.substring(1)) : path;
    }
}
