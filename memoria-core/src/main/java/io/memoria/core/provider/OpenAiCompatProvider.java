package io.memoria.core.provider;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Chat-completions client for OpenAI-compatible endpoints. One attempt per call: the pipeline's
 * secondary calls treat a failure as absent for the turn.
 */
public final class OpenAiCompatProvider implements CompletionProvider {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String name;
    private final String apiKey;
    private final HttpUrl apiBase;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final Map<String, String> extraHeaders;

    public OpenAiCompatProvider(String name, String apiKey, String apiBase, Map<String, String> extraHeaders) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(Duration.ofSeconds(90))
            .writeTimeout(Duration.ofSeconds(20))
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CompletionResponse complete(String prompt, CompletionParams params) {
        if (apiKey.isBlank()) {
            return CompletionResponse.credentialMissing("missing API key for provider " + name);
        }

        try {
            Request request = buildRequest(prompt, params);
            try (Response response = client.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    String errorBody = response.body() == null ? "" : response.body().string();
                    return CompletionResponse.error(
                        "HTTP " + response.code() + " " + errorBody,
                        Map.of("http_status", response.code())
                    );
                }
                ResponseBody body = response.body();
                if (body == null) {
                    return new CompletionResponse("", Map.of());
                }
                return parseJson(body.string());
            }
        } catch (IOException e) {
            return CompletionResponse.error(e.getMessage());
        } catch (RuntimeException e) {
            return CompletionResponse.error(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private Request buildRequest(String prompt, CompletionParams params) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", params.model());
        payload.put("messages", List.of(Map.of("role", "user", "content", prompt == null ? "" : prompt)));
        payload.put("temperature", params.temperature());
        payload.put("max_tokens", params.maxTokens());
        payload.put("stream", false);

        Request.Builder builder = new Request.Builder()
            .url(completionsUrl())
            .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
            .header("Authorization", "Bearer " + apiKey)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json");

        for (Map.Entry<String, String> header : extraHeaders.entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    private HttpUrl completionsUrl() {
        return apiBase.newBuilder()
            .addPathSegment("chat")
            .addPathSegment("completions")
            .build();
    }

    private CompletionResponse parseJson(String body) throws IOException {
        JsonNode root = mapper.readTree(body);
        String content = root.path("choices").path(0).path("message").path("content").asText("");
        JsonNode usage = root.path("usage");
        Map<String, Object> usageMap = usage.isObject()
            ? mapper.convertValue(usage, new TypeReference<Map<String, Object>>() {
            })
            : Map.of();
        return new CompletionResponse(content, usageMap);
    }
}
