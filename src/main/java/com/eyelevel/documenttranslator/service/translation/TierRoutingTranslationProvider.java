package com.eyelevel.documenttranslator.service.translation;

import com.eyelevel.documenttranslator.config.TranslationProperties;
import com.eyelevel.documenttranslator.exception.apiclient.BadRequestException;
import com.eyelevel.documenttranslator.exception.apiclient.UnauthorizedException;
import com.eyelevel.documenttranslator.model.TranslationTier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Function;

/**
 * The {@link TranslationProvider} the pipeline talks to. It routes each call by tier:
 * <ul>
 *     <li>{@code basic}: standard provider, single attempt.</li>
 *     <li>{@code standard}: standard provider with exponential-backoff retries.</li>
 *     <li>{@code premium}: premium provider with retries, falling back to the standard route when it
 *     still fails.</li>
 * </ul>
 * Requests rejected as malformed or unauthorized are not retried.
 */
@Slf4j
@Primary
@Service
public class TierRoutingTranslationProvider implements TranslationProvider {

    private final TranslationProvider standardProvider;
    private final TranslationProvider premiumProvider;
    private final RetryTemplate standardRetryTemplate;
    private final RetryTemplate premiumRetryTemplate;

    public TierRoutingTranslationProvider(
            @Qualifier("googleTranslateClient") final TranslationProvider standardProvider,
            @Qualifier("openAiTranslationClient") final TranslationProvider premiumProvider,
            final TranslationProperties translationProperties,
            final TranslationRetryListener translationRetryListener) {
        this.standardProvider = standardProvider;
        this.premiumProvider = premiumProvider;
        this.standardRetryTemplate = buildRetryTemplate(translationProperties.getStandard(), translationRetryListener);
        this.premiumRetryTemplate = buildRetryTemplate(translationProperties.getPremium(), translationRetryListener);
    }

    @Override
    public String name() {
        return "tier-routing";
    }

    @Override
    public String translate(final String text, final String sourceLang, final String targetLang,
                            final TranslationTier tier) {
        if (text == null || text.isBlank()) {
            return text;
        }
        return route(tier, provider -> provider.translate(text, sourceLang, targetLang, tier));
    }

    @Override
    public List<String> translateBatch(final List<String> texts, final String sourceLang, final String targetLang,
                                       final TranslationTier tier) {
        return route(tier, provider -> provider.translateBatch(texts, sourceLang, targetLang, tier));
    }

    private <T> T route(final TranslationTier tier, final Function<TranslationProvider, T> operation) {
        switch (tier) {
            case BASIC:
                return operation.apply(standardProvider);
            case PREMIUM:
                try {
                    return premiumRetryTemplate.execute(context -> operation.apply(premiumProvider));
                } catch (RuntimeException e) {
                    log.warn("Premium provider '{}' failed ({}). Falling back to '{}'.", premiumProvider.name(),
                            e.getMessage(), standardProvider.name());
                    return standardRetryTemplate.execute(context -> operation.apply(standardProvider));
                }
            case STANDARD:
            default:
                return standardRetryTemplate.execute(context -> operation.apply(standardProvider));
        }
    }

    private static RetryTemplate buildRetryTemplate(final TranslationProperties.RetryConfig retry,
                                                    final TranslationRetryListener listener) {
        final long initialDelay = Math.max(1, retry.getInitialDelayMs());
        return RetryTemplate.builder()
                .maxAttempts(Math.max(1, retry.getMaxAttempts()))
                .exponentialBackoff(initialDelay, Math.max(1.1, retry.getMultiplier()),
                        Math.max(initialDelay + 1, retry.getMaxDelayMs()))
                .notRetryOn(List.of(BadRequestException.class, UnauthorizedException.class))
                .traversingCauses()
                .withListener(listener)
                .build();
    }
}
