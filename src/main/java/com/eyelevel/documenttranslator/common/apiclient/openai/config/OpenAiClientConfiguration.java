package com.eyelevel.documenttranslator.common.apiclient.openai.config;

import com.eyelevel.documenttranslator.common.apiclient.authentication.Authentication;
import com.eyelevel.documenttranslator.common.apiclient.authentication.impl.BearerTokenAuthentication;
import com.eyelevel.documenttranslator.common.apiclient.model.HeaderConfig;
import com.eyelevel.documenttranslator.config.TranslationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Configures the beans behind the OpenAI chat-completions client used by the premium tier.
 */
@Slf4j
@Configuration
public class OpenAiClientConfiguration {

    @Bean("openAiWebClient")
    public WebClient openAiWebClient(TranslationProperties translationProperties) {
        String baseUrl = translationProperties.getOpenai().getBaseUrl();
        log.info("Initializing OpenAI WebClient with base URL: {}", baseUrl);
        return WebClient.builder()
                .baseUrl(baseUrl)
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(8 * 1024 * 1024))
                .build();
    }

    @Bean("openAiAuthentication")
    public Authentication openAiAuthentication(TranslationProperties translationProperties) {
        TranslationProperties.OpenAi openAi = translationProperties.getOpenai();
        if (!openAi.isConfigured()) {
            log.warn("OpenAI API key is not configured. Premium jobs will fall back to the standard provider.");
        }
        return new BearerTokenAuthentication(openAi.getApiKey());
    }

    @Bean("openAiHeader")
    public HeaderConfig openAiHeader() {
        return new HeaderConfig();
    }
}
