package io.chimera.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.chimera.core.config.model.ChimeraConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

public final class ConfigService {
    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
    }

    public ChimeraConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return ChimeraConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(ChimeraConfig.defaults());
        JsonNode existingNode = normalizeAliases(mapper.readTree(Files.readString(configPath)));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, ChimeraConfig.class);
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }

    // snake_case keys would otherwise sit next to the camelCase defaults and lose the merge
    private JsonNode normalizeAliases(JsonNode node) {
        if (node == null || !node.isObject()) {
            return node;
        }
        ObjectNode normalized = mapper.createObjectNode();
        node.fields().forEachRemaining(entry ->
            normalized.set(toCamelCase(entry.getKey()), normalizeAliases(entry.getValue()))
        );
        return normalized;
    }

    private String toCamelCase(String key) {
        if (key.indexOf('_') < 0) {
            return key;
        }
        StringBuilder out = new StringBuilder(key.length());
        boolean upper = false;
        for (char c : key.toCharArray()) {
            if (c == '_') {
                upper = true;
                continue;
            }
            out.append(upper ? Character.toUpperCase(c) : c);
            upper = false;
        }
        return out.toString();
    }
}
