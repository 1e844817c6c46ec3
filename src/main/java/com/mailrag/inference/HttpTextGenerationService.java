package com.mailrag.inference;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailrag.runtime.AppConfig;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

public class HttpTextGenerationService implements TextGenerationService {
    private static final MediaType JSON = MediaType.parse("application/json");
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final AppConfig.GenerationConfig config;
    private final String apiKey;

    public HttpTextGenerationService(OkHttpClient httpClient, AppConfig.GenerationConfig config, String apiKey) {
        if (config.getEndpoint() == null || config.getEndpoint().isBlank()) {
            throw new IllegalArgumentException("generation.endpoint must be set");
        }
        this.httpClient = httpClient;
        this.config = config;
        this.apiKey = apiKey;
    }

    @Override
    public String generate(String systemContext, List<ChatMessage> history) throws IOException {
        List<Map<String, String>> messages = new ArrayList<>();
        for (ChatMessage message : history) {
            messages.add(Map.of("role", message.role().name().toLowerCase(Locale.ROOT), "content", message.content()));
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", config.getModel());
        payload.put("system", systemContext == null ? "" : systemContext);
        payload.put("messages", messages);
        payload.put("max_tokens", config.getMaxTokens());
        payload.put("temperature", config.getTemperature());

        Request.Builder requestBuilder = new Request.Builder()
                .url(config.getEndpoint())
                .post(RequestBody.create(mapper.writeValueAsString(payload), JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            requestBuilder.header("Authorization", "Bearer " + apiKey);
        }
        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new IOException("Generation endpoint returned HTTP " + response.code());
            }
            JsonNode root = mapper.readTree(body.string());
            JsonNode text = root.path("text");
            if (text.isTextual()) {
                return text.asText();
            }
            JsonNode content = root.path("content").path(0).path("text");
            if (content.isTextual()) {
                return content.asText();
            }
            throw new IOException("Generation response carries no text");
        }
    }
}
