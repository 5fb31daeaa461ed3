package io.memoria.core.provider;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenAiCompatProviderTest {

    private static final CompletionParams PARAMS = new CompletionParams("gpt-4o-mini", 0.3, 200);

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldParseJsonCompletionResponse() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "choices": [
                    { "message": { "content": "They talked about a trip to Lisbon." } }
                  ],
                  "usage": { "total_tokens": 42 }
                }
                """));

        OpenAiCompatProvider provider = new OpenAiCompatProvider(
            "openai",
            "sk-test",
            server.url("/v1").toString(),
            Map.of("X-App", "memoria")
        );

        CompletionResponse response = provider.complete("summarize", PARAMS);

        assertThat(response.text()).isEqualTo("They talked about a trip to Lisbon.");
        assertThat(response.usage()).containsEntry("total_tokens", 42);

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");
        assertThat(request.getHeader("X-App")).isEqualTo("memoria");
        assertThat(request.getBody().readUtf8()).contains("\"stream\":false", "\"model\":\"gpt-4o-mini\"", "\"max_tokens\":200");
    }

    @Test
    void shouldReturnErrorResponseForHttpFailures() {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("rate limited"));
        OpenAiCompatProvider provider = new OpenAiCompatProvider("openai", "sk-test", server.url("/v1/").toString(), Map.of());

        CompletionResponse response = provider.complete("summarize", PARAMS);

        assertThat(response.isError()).isTrue();
        assertThat(response.errorDetail()).isEqualTo("HTTP 429 rate limited");
    }

    @Test
    void shouldReportMissingKey() {
        OpenAiCompatProvider provider = new OpenAiCompatProvider("openai", " ", server.url("/v1").toString(), null);

        CompletionResponse response = provider.complete("summarize", PARAMS);

        assertThat(response.isCredentialMissing()).isTrue();
        assertThat(server.getRequestCount()).isZero();
    }
}
