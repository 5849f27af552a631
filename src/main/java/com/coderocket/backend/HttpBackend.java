package com.coderocket.backend;

import com.coderocket.config.ConfigStore;
import com.coderocket.model.AiBackend;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Shared plumbing for backends reached over HTTP with a JSON body.
 */
abstract class HttpBackend implements Backend {

    private static final Logger log = LoggerFactory.getLogger(HttpBackend.class);

    protected static final ObjectMapper MAPPER = new ObjectMapper();
    protected static final MediaType JSON = MediaType.parse("application/json");

    private static final int MAX_ERROR_BODY = 500;

    // The orchestrator enforces the per-attempt timeout; these only bound a stuck socket.
    private static final OkHttpClient HTTP = new OkHttpClient.Builder()
            .connectTimeout(30, TimeUnit.SECONDS)
            .readTimeout(300, TimeUnit.SECONDS)
            .build();

    protected final ConfigStore config;
    private final AiBackend id;

    protected HttpBackend(AiBackend id, ConfigStore config) {
        this.id = id;
        this.config = config;
    }

    @Override
    public AiBackend id() {
        return id;
    }

    @Override
    public boolean isConfigured() {
        return !config.getApiKey(id).isEmpty();
    }

    @Override
    public String invoke(String prompt) throws BackendException {
        String apiKey = config.getApiKey(id);
        if (apiKey.isEmpty()) {
            throw new BackendException(id, "%s is not configured (missing %s)"
                    .formatted(id.displayName(), config.getApiKeyEnvVar(id)));
        }

        JsonNode root;
        try {
            Request request = buildRequest(prompt, apiKey);
            try (Response response = HTTP.newCall(request).execute()) {
                String body = response.body() != null ? response.body().string() : "";
                if (!response.isSuccessful()) {
                    throw new BackendException(id, "%s API error (HTTP %d): %s"
                            .formatted(id.displayName(), response.code(), errorMessage(body)));
                }
                root = MAPPER.readTree(body);
            }
        } catch (IOException e) {
            throw new BackendException(id, "%s API call failed: %s".formatted(id.displayName(), e.getMessage()), e);
        }

        String text = extractText(root);
        if (text == null || text.isBlank()) {
            throw new BackendException(id, "%s returned an empty response".formatted(id.displayName()));
        }
        return text;
    }

    /** Build the HTTP request for one prompt. */
    protected abstract Request buildRequest(String prompt, String apiKey) throws IOException;

    /**
     * Pull the generated text out of a successful response.
     *
     * @return the text, or null when the response carries none
     */
    protected abstract String extractText(JsonNode root) throws BackendException;

    protected String baseUrl() {
        String url = config.getBaseUrl(id);
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String errorMessage(String body) {
        if (body.isBlank()) return "Unknown error";
        try {
            JsonNode message = MAPPER.readTree(body).path("error").path("message");
            if (message.isTextual()) return message.asText();
        } catch (IOException e) {
            log.debug("Error body is not JSON: {}", e.getMessage());
        }
        return body.length() > MAX_ERROR_BODY ? body.substring(0, MAX_ERROR_BODY) + "..." : body;
    }
}
