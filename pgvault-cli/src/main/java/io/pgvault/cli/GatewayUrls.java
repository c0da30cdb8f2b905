package io.pgvault.cli;

import io.pgvault.core.config.model.GatewayConfig;
import io.pgvault.core.config.model.PgvaultConfig;

final class GatewayUrls {

    private GatewayUrls() {
    }

    static String resolve(String override, CliContext context) throws Exception {
        if (override != null && !override.isBlank()) {
            return override.trim();
        }
        PgvaultConfig config = context.configService().load(context.configPath());
        GatewayConfig gateway = config.gateway();
        String host = gateway.host() == null || gateway.host().isBlank() || "0.0.0.0".equals(gateway.host())
            ? "127.0.0.1"
            : gateway.host();
        return "http://" + host + ":" + gateway.port() + "/";
    }
}
