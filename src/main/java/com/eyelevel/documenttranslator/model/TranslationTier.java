package com.eyelevel.documenttranslator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Quality/cost level requested at submission. The translation stage uses it to pick a provider
 * and a retry policy.
 */
public enum TranslationTier {
    BASIC("basic"),
    STANDARD("standard"),
    PREMIUM("premium");

    private final String value;

    TranslationTier(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parses a tier from its lower-case name, ignoring case and surrounding whitespace.
     *
     * @param value the tier name as sent by a client.
     * @return the matching tier.
     * @throws IllegalArgumentException if the value names no tier.
     */
    @JsonCreator
    public static TranslationTier fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Translation tier must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(tier -> tier.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown translation tier: '" + value
                        + "'. Expected one of basic, standard, premium."));
    }
}
