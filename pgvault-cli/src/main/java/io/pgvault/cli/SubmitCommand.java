package io.pgvault.cli;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "submit", description = "Schedule a recurring backup on a running service")
public final class SubmitCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Owner (server) id")
    int ownerId;

    @Option(names = {"--type"}, required = true, description = "one_time, daily, weekly or monthly")
    String type;

    @Option(names = {"--start"}, required = true, description = "First run, yyyy-MM-dd HH:mm:ss")
    String start;

    @Option(names = {"--file"}, description = "Backup target file")
    String file;

    @Option(names = {"--database"}, description = "Database to back up")
    String database;

    @Option(names = {"--format"}, description = "Backup format passed to the utility")
    String format;

    @Option(names = {"--url"}, description = "Gateway base URL (defaults to the configured gateway)")
    String url;

    public SubmitCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("enable_scheduler", true);
            body.put("schedule_type", type);
            body.put("start_date_time", start);
            putIfPresent(body, "file", file);
            putIfPresent(body, "database", database);
            putIfPresent(body, "format", format);

            JsonNode response = new GatewayClient(GatewayUrls.resolve(url, context)).submit(ownerId, body);
            System.out.println("Scheduled job " + response.path("job_id").asText()
                + ", next run " + response.path("next_run").asText("none"));
            return 0;
        } catch (Exception e) {
            System.err.println("Submit command failed: " + e.getMessage());
            return 1;
        }
    }

    private void putIfPresent(Map<String, Object> body, String key, String value) {
        if (value != null && !value.isBlank()) {
            body.put(key, value);
        }
    }
}
