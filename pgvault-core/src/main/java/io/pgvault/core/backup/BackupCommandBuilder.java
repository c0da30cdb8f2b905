package io.pgvault.core.backup;

import java.util.List;
import java.util.Map;

@FunctionalInterface
public interface BackupCommandBuilder {
    List<String> build(int ownerId, Map<String, Object> payload);
}
