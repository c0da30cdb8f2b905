package io.pgvault.cli;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "status", description = "Show scheduler state and scheduled jobs of a running service")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--url"}, description = "Gateway base URL (defaults to the configured gateway)")
    String url;

    @Option(names = {"--owner"}, description = "Only list jobs of this owner")
    Integer owner;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            String baseUrl = GatewayUrls.resolve(url, context);
            GatewayClient client = new GatewayClient(baseUrl);
            JsonNode status = client.status();
            System.out.println("Gateway: " + baseUrl);
            System.out.println("State: " + status.path("state").asText());
            System.out.println("Running: " + status.path("running").asBoolean());
            System.out.println("Jobs: " + status.path("job_count").asInt());
            System.out.println("Consecutive loop failures: " + status.path("consecutive_loop_failures").asInt());
            String lastError = status.path("last_loop_error").asText("");
            if (!lastError.isBlank()) {
                System.out.println("Last loop error: " + lastError);
            }
            if (owner != null) {
                System.out.println("Owner " + owner + ":");
                for (JsonNode job : client.jobs(owner).path("jobs")) {
                    System.out.println("  " + describe(job));
                }
                return 0;
            }
            for (JsonNode entry : status.path("owners")) {
                System.out.println("Owner " + entry.path("owner_id").asInt() + ":");
                for (JsonNode job : entry.path("jobs")) {
                    System.out.println("  " + describe(job));
                }
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }

    private String describe(JsonNode job) {
        String nextRun = job.path("next_run").isNull() ? "none" : job.path("next_run").asText("none");
        return job.path("job_id").asText()
            + " " + job.path("recurrence").asText().toLowerCase(Locale.ROOT)
            + " next=" + nextRun
            + " runs=" + job.path("run_count").asInt()
            + " last=" + job.path("last_outcome").asText();
    }
}
