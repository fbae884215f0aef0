package com.eyelevel.documenttranslator.common.apiclient.openai;

import com.eyelevel.documenttranslator.common.apiclient.ApiClient;
import com.eyelevel.documenttranslator.common.apiclient.authentication.Authentication;
import com.eyelevel.documenttranslator.common.apiclient.model.ApiRequest;
import com.eyelevel.documenttranslator.common.apiclient.model.ApiResponse;
import com.eyelevel.documenttranslator.common.apiclient.model.HeaderConfig;
import com.eyelevel.documenttranslator.common.json.JsonParser;
import com.eyelevel.documenttranslator.common.json.JsonSerializer;
import com.eyelevel.documenttranslator.config.TranslationProperties;
import com.eyelevel.documenttranslator.exception.TranslationProviderException;
import com.eyelevel.documenttranslator.model.TranslationTier;
import com.eyelevel.documenttranslator.service.translation.TranslationProvider;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Chat-completions client used for the premium tier. Batches are sent as a JSON array and must come back
 * as a JSON array of the same length.
 */
@Slf4j
@Service("openAiTranslationClient")
public class OpenAiTranslationClient extends ApiClient implements TranslationProvider {

    private static final Duration OPENAI_TIMEOUT = Duration.ofSeconds(90);

    private final JsonParser jsonParser;
    private final JsonSerializer jsonSerializer;
    private final TranslationProperties.OpenAi settings;

    public OpenAiTranslationClient(
            @Qualifier("openAiWebClient") final WebClient webClient,
            @Qualifier("openAiAuthentication") final Authentication authentication,
            @Qualifier("openAiHeader") final HeaderConfig headerConfig,
            @Qualifier("jacksonJsonParser") final JsonParser jsonParser,
            @Qualifier("jacksonJsonSerializer") final JsonSerializer jsonSerializer,
            final TranslationProperties translationProperties
    ) {
        super(webClient, authentication, headerConfig, OPENAI_TIMEOUT);
        this.jsonParser = jsonParser;
        this.jsonSerializer = jsonSerializer;
        this.settings = translationProperties.getOpenai();
    }

    @Override
    public String name() {
        return "openai";
    }

    @Override
    public String translate(final String text, final String sourceLang, final String targetLang,
                            final TranslationTier tier) {
        final String systemPrompt = String.format(
                "You are a professional document translator. Translate the user's text from %s to %s. "
                + "Preserve paragraph breaks and formatting. Reply with the translation only.",
                describe(sourceLang), targetLang);
        return complete(systemPrompt, text);
    }

    @Override
    public List<String> translateBatch(final List<String> texts, final String sourceLang, final String targetLang,
                                       final TranslationTier tier) {
        final String systemPrompt = String.format(
                "You are a professional document translator. The user sends a JSON array of strings in %s. "
                + "Translate every element to %s and reply with only a JSON array of the translated strings, "
                + "same length and order as the input.", describe(sourceLang), targetLang);
        final String content = stripCodeFence(complete(systemPrompt, jsonSerializer.serialize(texts)));
        final List<String> translated = jsonParser.parseList(content, String.class);
        if (translated.size() != texts.size()) {
            throw new TranslationProviderException(String.format(
                    "OpenAI batch returned %d translations for %d inputs", translated.size(), texts.size()));
        }
        return translated;
    }

    private String complete(final String systemPrompt, final String userContent) {
        if (!settings.isConfigured()) {
            throw new TranslationProviderException("OpenAI API key is not configured");
        }
        final ApiResponse apiResponse = call(ApiRequest.builder()
                .operation("openai.chat-completion")
                .method(HttpMethod.POST)
                .path(settings.getPath())
                .body(Map.of(
                        "model", settings.getModel(),
                        "temperature", settings.getTemperature(),
                        "messages", List.of(
                                Map.of("role", "system", "content", systemPrompt),
                                Map.of("role", "user", "content", userContent))))
                .contentType(MediaType.APPLICATION_JSON)
                .acceptMediaType(MediaType.APPLICATION_JSON)
                .build());

        final JsonNode content = jsonParser.parseObject(apiResponse.getData(), JsonNode.class)
                .path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new TranslationProviderException("OpenAI response did not contain a message content");
        }
        return content.asText().trim();
    }

    private static String describe(final String sourceLang) {
        return "auto".equals(sourceLang) ? "the detected source language" : sourceLang;
    }

    private static String stripCodeFence(final String content) {
        String trimmed = content.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int closingFence = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && closingFence > firstNewline) {
                trimmed = trimmed.substring(firstNewline + 1, closingFence).trim();
            }
        }
        return trimmed;
    }
}
