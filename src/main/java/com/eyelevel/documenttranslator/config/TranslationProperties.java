package com.eyelevel.documenttranslator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds application properties under the "app.translation" prefix: chunking limits,
 * per-tier retry policy and provider endpoints.
 */
@Data
@ConfigurationProperties(prefix = "app.translation")
public class TranslationProperties {

    /**
     * Target chunk size in characters.
     */
    private int chunkSize = 3000;

    /**
     * Chunk counts up to this value are sent as a single batch call.
     */
    private int batchThreshold = 10;

    private RetryConfig standard = new RetryConfig();
    private RetryConfig premium = new RetryConfig();
    private Google google = new Google();
    private OpenAi openai = new OpenAi();

    @Data
    public static class RetryConfig {
        private int maxAttempts = 3;
        private long initialDelayMs = 1000;
        private double multiplier = 2.0;
        private long maxDelayMs = 10000;
    }

    @Data
    public static class Google {
        private String baseUrl = "https://translate.googleapis.com";
        private String path = "/translate_a/single";
    }

    @Data
    public static class OpenAi {
        private String baseUrl = "https://api.openai.com";
        private String path = "/v1/chat/completions";
        private String apiKey;
        private String model = "gpt-4o-mini";
        private double temperature = 0.2;

        public boolean isConfigured() {
            return apiKey != null && !apiKey.isBlank();
        }
    }
}
