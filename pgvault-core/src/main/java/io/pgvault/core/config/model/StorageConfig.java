package io.pgvault.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(String type, String path) {

    public static StorageConfig defaults() {
        return new StorageConfig("sqlite", "~/.pgvault/jobs.db");
    }

    public boolean enabled() {
        return type != null && "sqlite".equalsIgnoreCase(type.trim());
    }
}
