package com.coderocket.backend;

import com.coderocket.config.ConfigStore;
import com.coderocket.model.AiBackend;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.HttpUrl;
import okhttp3.Request;
import okhttp3.RequestBody;

import java.io.IOException;

/**
 * Google Gemini via the generateContent REST endpoint.
 */
public class GeminiBackend extends HttpBackend {

    public GeminiBackend(ConfigStore config) {
        super(AiBackend.GEMINI, config);
    }

    @Override
    protected Request buildRequest(String prompt, String apiKey) throws IOException {
        ObjectNode requestBody = MAPPER.createObjectNode();
        requestBody.putArray("contents")
                .addObject()
                .putArray("parts")
                .addObject()
                .put("text", prompt);

        HttpUrl url = HttpUrl.get(baseUrl() + "/v1beta/models/" + config.getModel(id()) + ":generateContent")
                .newBuilder()
                .addQueryParameter("key", apiKey)
                .build();

        return new Request.Builder()
                .url(url)
                .post(RequestBody.create(MAPPER.writeValueAsString(requestBody), JSON))
                .build();
    }

    @Override
    protected String extractText(JsonNode root) {
        JsonNode parts = root.path("candidates").path(0).path("content").path("parts");
        if (!parts.isArray()) return null;

        StringBuilder text = new StringBuilder();
        for (JsonNode part : parts) {
            text.append(part.path("text").asText(""));
        }
        return text.toString();
    }
}
