package com.mailrag.ingest;

import java.util.Locale;
import java.util.Map;

import com.mailrag.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class EmbeddingServices {
    private EmbeddingServices() {
    }

    public static EmbeddingService create(AppConfig.EmbeddingConfig config, OkHttpClient httpClient, Map<String, String> environment) {
        String provider = config.getProvider() == null ? "hashing" : config.getProvider().toLowerCase(Locale.ROOT);
        return switch (provider) {
            case "hashing" -> new HashingEmbeddingService(config.getDimension());
            case "http" -> {
                if (config.getEndpoint() == null || config.getEndpoint().isBlank()) {
                    throw new IllegalArgumentException("embedding.endpoint is required for the http provider");
                }
                String apiKey = config.getApiKeyEnv() == null ? null : environment.get(config.getApiKeyEnv());
                yield new HttpEmbeddingService(httpClient, config.getEndpoint(), apiKey, config.getDimension());
            }
            default -> throw new IllegalArgumentException("Unknown embedding provider: " + config.getProvider());
        };
    }
}
