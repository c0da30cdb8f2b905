package io.pgvault.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pgvault.core.config.model.PgvaultConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

public final class ConfigService {
    private final ObjectMapper mapper = new ObjectMapper();

    public PgvaultConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        ObjectNode tree = defaultsTree();
        if (Files.exists(configPath)) {
            overlay(tree, readFile(configPath));
        }
        return mapper.treeToValue(tree, PgvaultConfig.class);
    }

    public InitResult init(Path configPath, boolean overwrite) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        boolean created = !Files.exists(configPath);
        ObjectNode tree = defaultsTree();
        if (!created && !overwrite) {
            overlay(tree, readFile(configPath));
        }

        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(configPath, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(tree) + System.lineSeparator());
        return new InitResult(configPath, created, !created && overwrite);
    }

    private ObjectNode defaultsTree() {
        return mapper.valueToTree(PgvaultConfig.defaults());
    }

    private JsonNode readFile(Path configPath) throws IOException {
        try {
            JsonNode node = mapper.readTree(Files.readString(configPath));
            if (node != null && !node.isObject() && !node.isMissingNode()) {
                throw new IOException("Config file " + configPath + " must contain a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new IOException("Config file " + configPath + " is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    // values from the file win; objects merge key by key so missing keys keep their defaults
    private void overlay(ObjectNode target, JsonNode source) {
        if (source == null || !source.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode current = target.get(field.getKey());
            if (current instanceof ObjectNode nested && field.getValue().isObject()) {
                overlay(nested, field.getValue());
            } else {
                target.set(field.getKey(), field.getValue());
            }
        }
    }
}
