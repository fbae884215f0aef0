package com.eyelevel.documenttranslator.common.apiclient.google;

import com.eyelevel.documenttranslator.common.apiclient.ApiClient;
import com.eyelevel.documenttranslator.common.apiclient.authentication.Authentication;
import com.eyelevel.documenttranslator.common.apiclient.model.ApiRequest;
import com.eyelevel.documenttranslator.common.apiclient.model.ApiResponse;
import com.eyelevel.documenttranslator.common.apiclient.model.HeaderConfig;
import com.eyelevel.documenttranslator.common.json.JsonParser;
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
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Map;

/**
 * Client for the public Google Translate endpoint ({@code client=gtx}). The text goes in a form body so
 * long chunks do not hit URL length limits.
 * <p>
 * The response is a nested JSON array whose first element lists translated segments; each segment's
 * first element is the translated text.
 */
@Slf4j
@Service("googleTranslateClient")
public class GoogleTranslateClient extends ApiClient implements TranslationProvider {

    private final JsonParser jsonParser;
    private final String translatePath;

    public GoogleTranslateClient(
            @Qualifier("googleTranslateWebClient") final WebClient webClient,
            @Qualifier("googleTranslateAuthentication") final Authentication authentication,
            @Qualifier("googleTranslateHeader") final HeaderConfig headerConfig,
            @Qualifier("jacksonJsonParser") final JsonParser jsonParser,
            final TranslationProperties translationProperties
    ) {
        super(webClient, authentication, headerConfig);
        this.jsonParser = jsonParser;
        this.translatePath = translationProperties.getGoogle().getPath();
    }

    @Override
    public String name() {
        return "google";
    }

    @Override
    public String translate(final String text, final String sourceLang, final String targetLang,
                            final TranslationTier tier) {
        final ApiResponse apiResponse = call(prepareTranslateRequest(text, sourceLang, targetLang));
        final JsonNode root = jsonParser.parseObject(apiResponse.getData(), JsonNode.class);

        final JsonNode segments = root.path(0);
        if (!segments.isArray()) {
            throw new TranslationProviderException("Unexpected Google Translate response: no translation segments");
        }
        final StringBuilder translated = new StringBuilder();
        for (final JsonNode segment : segments) {
            final JsonNode segmentText = segment.path(0);
            if (segmentText.isTextual()) {
                translated.append(segmentText.asText());
            }
        }
        log.debug("Google translated {} chars into {} chars ({} -> {}).", text.length(), translated.length(),
                sourceLang, targetLang);
        return translated.toString();
    }

    private ApiRequest prepareTranslateRequest(final String text, final String sourceLang, final String targetLang) {
        final MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("q", text);
        return ApiRequest.builder()
                .operation("google.translate")
                .method(HttpMethod.POST)
                .path(translatePath)
                .queryParams(Map.of(
                        "client", List.of("gtx"),
                        "sl", List.of(sourceLang),
                        "tl", List.of(targetLang),
                        "dt", List.of("t")))
                .body(form)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .acceptMediaType(MediaType.APPLICATION_JSON)
                .build();
    }
}
