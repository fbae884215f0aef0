package com.eyelevel.documenttranslator.common.apiclient.google.config;

import com.eyelevel.documenttranslator.common.apiclient.authentication.Authentication;
import com.eyelevel.documenttranslator.common.apiclient.model.HeaderConfig;
import com.eyelevel.documenttranslator.config.TranslationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Configures the {@link WebClient}, {@link Authentication} and static headers used by the Google
 * Translate client. The public endpoint needs no credentials.
 */
@Slf4j
@Configuration
public class GoogleTranslateClientConfiguration {

    @Bean("googleTranslateWebClient")
    public WebClient googleTranslateWebClient(TranslationProperties translationProperties) {
        String baseUrl = translationProperties.getGoogle().getBaseUrl();
        log.info("Initializing Google Translate WebClient with base URL: {}", baseUrl);
        return WebClient.builder()
                .baseUrl(baseUrl)
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                .build();
    }

    @Bean("googleTranslateAuthentication")
    public Authentication googleTranslateAuthentication() {
        return Authentication.NONE;
    }

    @Bean("googleTranslateHeader")
    public HeaderConfig googleTranslateHeader() {
        return new HeaderConfig().add(HttpHeaders.USER_AGENT, "document-translator/1.0");
    }
}
