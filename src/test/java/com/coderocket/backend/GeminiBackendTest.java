package com.coderocket.backend;

import com.coderocket.config.ConfigStore;
import com.coderocket.model.AiBackend;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GeminiBackendTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tmp;

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

    private GeminiBackend backend(String apiKey) {
        Map<String, String> env = new HashMap<>();
        env.put("GEMINI_BASE_URL", server.url("/").toString());
        env.put("GEMINI_MODEL", "gemini-test");
        if (apiKey != null) env.put("GEMINI_API_KEY", apiKey);
        ConfigStore config = new ConfigStore(tmp, tmp, env);
        config.initialize();
        return new GeminiBackend(config);
    }

    @Test
    @DisplayName("posts the prompt to generateContent and joins the returned parts")
    void generatesText() throws Exception {
        server.enqueue(new MockResponse().setBody("""
                {"candidates":[{"content":{"parts":[{"text":"Looks "},{"text":"fine."}]}}]}
                """));

        String text = backend("g-key").invoke("review this");

        assertThat(text).isEqualTo("Looks fine.");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getRequestUrl().encodedPath()).isEqualTo("/v1beta/models/gemini-test:generateContent");
        assertThat(request.getRequestUrl().queryParameter("key")).isEqualTo("g-key");
        JsonNode body = MAPPER.readTree(request.getBody().readUtf8());
        assertThat(body.path("contents").path(0).path("parts").path(0).path("text").asText())
                .isEqualTo("review this");
    }

    @Test
    @DisplayName("reports the API error message on non-2xx responses")
    void apiError() {
        server.enqueue(new MockResponse().setResponseCode(400)
                .setBody("{\"error\":{\"message\":\"API key not valid\"}}"));

        assertThatThrownBy(() -> backend("bad").invoke("p"))
                .isInstanceOfSatisfying(BackendException.class,
                        e -> assertThat(e.getBackend()).isEqualTo(AiBackend.GEMINI))
                .hasMessage("Gemini API error (HTTP 400): API key not valid");
    }

    @Test
    @DisplayName("an empty candidate list is a failure")
    void emptyResponse() {
        server.enqueue(new MockResponse().setBody("{\"candidates\":[]}"));

        assertThatThrownBy(() -> backend("g-key").invoke("p"))
                .isInstanceOf(BackendException.class)
                .hasMessage("Gemini returned an empty response");
    }

    @Test
    @DisplayName("fails without calling the API when no key is configured")
    void notConfigured() {
        GeminiBackend backend = backend(null);

        assertThat(backend.isConfigured()).isFalse();
        assertThatThrownBy(() -> backend.invoke("p"))
                .isInstanceOf(BackendException.class)
                .hasMessageContaining("GEMINI_API_KEY");
        assertThat(server.getRequestCount()).isZero();
    }
}
