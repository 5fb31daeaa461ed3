package io.memoria.core.provider;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.memoria.core.secret.CredentialProvider;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Calls the Gemini {@code generateContent} endpoint. The API key is fetched from the
 * credential provider on every call, so cached credentials can be invalidated after a rejection.
 */
public final class GeminiProvider implements CompletionProvider {
    private static final Logger LOG = LoggerFactory.getLogger(GeminiProvider.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    public static final String DEFAULT_API_BASE = "https://generativelanguage.googleapis.com/v1beta";

    private final CredentialProvider credentials;
    private final String credentialName;
    private final HttpUrl apiBase;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public GeminiProvider(CredentialProvider credentials, String apiBase) {
        this(credentials, CredentialProvider.GEMINI_API_KEY, apiBase);
    }

    public GeminiProvider(CredentialProvider credentials, String credentialName, String apiBase) {
        this.credentials = Objects.requireNonNull(credentials, "credentials must not be null");
        this.credentialName = Objects.requireNonNull(credentialName, "credentialName must not be null");
        this.apiBase = HttpUrl.get(apiBase == null || apiBase.isBlank() ? DEFAULT_API_BASE : apiBase);
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(Duration.ofSeconds(90))
            .writeTimeout(Duration.ofSeconds(20))
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return "gemini";
    }

    @Override
    public CompletionResponse complete(String prompt, CompletionParams params) {
        Optional<String> apiKey = credentials.fetch(credentialName);
        if (apiKey.isEmpty()) {
            return CompletionResponse.credentialMissing("missing API key " + credentialName + " for provider gemini");
        }

        try {
            Request request = buildRequest(apiKey.get(), prompt, params);
            try (Response response = client.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    String errorBody = response.body() == null ? "" : response.body().string();
                    if (response.code() == 401 || response.code() == 403) {
                        LOG.warn("Gemini rejected credential {}, invalidating cached value", credentialName);
                        credentials.invalidate(credentialName);
                    }
                    return CompletionResponse.error(
                        "HTTP " + response.code() + " " + errorBody,
                        Map.of("http_status", response.code())
                    );
                }
                ResponseBody body = response.body();
                if (body == null) {
                    return new CompletionResponse("", Map.of());
                }
                return parse(body.string());
            }
        } catch (IOException e) {
            return CompletionResponse.error(e.getMessage());
        } catch (RuntimeException e) {
            return CompletionResponse.error(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private Request buildRequest(String apiKey, String prompt, CompletionParams params) throws IOException {
        Map<String, Object> generationConfig = new LinkedHashMap<>();
        generationConfig.put("temperature", params.temperature());
        generationConfig.put("maxOutputTokens", params.maxTokens());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("contents", List.of(Map.of("role", "user", "parts", List.of(Map.of("text", prompt == null ? "" : prompt)))));
        payload.put("generationConfig", generationConfig);

        HttpUrl url = apiBase.newBuilder()
            .addPathSegment("models")
            .addPathSegment(params.model() + ":generateContent")
            .build();

        return new Request.Builder()
            .url(url)
            .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
            .header("x-goog-api-key", apiKey)
            .header("Content-Type", "application/json")
            .build();
    }

    private CompletionResponse parse(String body) throws IOException {
        JsonNode root = mapper.readTree(body);
        StringBuilder text = new StringBuilder();
        for (JsonNode part : root.path("candidates").path(0).path("content").path("parts")) {
            text.append(part.path("text").asText(""));
        }
        JsonNode usage = root.path("usageMetadata");
        Map<String, Object> usageMap = usage.isObject()
            ? mapper.convertValue(usage, new TypeReference<Map<String, Object>>() {
            })
            : Map.of();
        return new CompletionResponse(text.toString(), usageMap);
    }
}
