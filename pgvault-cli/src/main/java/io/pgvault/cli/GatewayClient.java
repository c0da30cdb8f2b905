package io.pgvault.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

public final class GatewayClient {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final HttpUrl baseUrl;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public GatewayClient(String baseUrl) {
        this.baseUrl = HttpUrl.get(Objects.requireNonNull(baseUrl, "baseUrl must not be null"));
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(5))
            .readTimeout(Duration.ofSeconds(30))
            .writeTimeout(Duration.ofSeconds(10))
            .build();
        this.mapper = new ObjectMapper();
    }

    public JsonNode status() throws IOException {
        Request request = new Request.Builder()
            .url(url("scheduler", "status"))
            .get()
            .build();
        return execute(request);
    }

    public JsonNode jobs(Integer ownerId) throws IOException {
        HttpUrl.Builder url = url("scheduler", "jobs").newBuilder();
        if (ownerId != null) {
            url.addQueryParameter("owner", String.valueOf(ownerId));
        }
        Request request = new Request.Builder()
            .url(url.build())
            .get()
            .build();
        return execute(request);
    }

    public JsonNode submit(int ownerId, Map<String, Object> body) throws IOException {
        Request request = new Request.Builder()
            .url(url("backup", "job", String.valueOf(ownerId)))
            .post(RequestBody.create(mapper.writeValueAsString(body), JSON))
            .build();
        return execute(request);
    }

    private JsonNode execute(Request request) throws IOException {
        try (Response response = client.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String raw = responseBody == null ? "" : responseBody.string();
            JsonNode json = raw.isBlank() ? mapper.createObjectNode() : mapper.readTree(raw);
            if (!response.isSuccessful()) {
                String error = json.path("error").asText("");
                throw new IOException("Gateway returned HTTP " + response.code()
                    + (error.isBlank() ? "" : ": " + error));
            }
            return json;
        }
    }

    private HttpUrl url(String... segments) {
        HttpUrl.Builder builder = baseUrl.newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder.build();
    }
}
