package com.coderocket.backend;

import com.coderocket.config.ConfigStore;
import com.coderocket.model.AiBackend;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.Request;
import okhttp3.RequestBody;

import java.io.IOException;

/**
 * Anthropic Claude via the Messages API.
 */
public class ClaudeBackend extends HttpBackend {

    static final String API_VERSION = "2023-06-01";
    static final int MAX_TOKENS = 4000;

    public ClaudeBackend(ConfigStore config) {
        super(AiBackend.CLAUDECODE, config);
    }

    @Override
    protected Request buildRequest(String prompt, String apiKey) throws IOException {
        ObjectNode requestBody = MAPPER.createObjectNode();
        requestBody.put("model", config.getModel(id()));
        requestBody.put("max_tokens", MAX_TOKENS);
        ObjectNode message = requestBody.putArray("messages").addObject();
        message.put("role", "user");
        message.put("content", prompt);

        return new Request.Builder()
                .url(baseUrl() + "/v1/messages")
                .header("x-api-key", apiKey)
                .header("anthropic-version", API_VERSION)
                .post(RequestBody.create(MAPPER.writeValueAsString(requestBody), JSON))
                .build();
    }

    @Override
    protected String extractText(JsonNode root) throws BackendException {
        JsonNode content = root.path("content").path(0);
        if (content.isMissingNode()) return null;
        if (!"text".equals(content.path("type").asText())) {
            throw new BackendException(id(), "Claude returned a non-text response");
        }
        return content.path("text").asText("");
    }
}
