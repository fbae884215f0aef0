package com.eyelevel.documenttranslator.service.submission;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Locale;
import java.util.Map;

/**
 * Maps user-supplied language names to the short codes the translation providers expect.
 * Unknown values pass through lower-cased.
 */
@Component
public class LanguageNormalizer {

    public static final String AUTO_DETECT = "auto";
    public static final String DEFAULT_SOURCE = AUTO_DETECT;
    public static final String DEFAULT_TARGET = "vi";

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("english", "en"),
            Map.entry("eng", "en"),
            Map.entry("vietnamese", "vi"),
            Map.entry("vie", "vi"),
            Map.entry("chinese", "zh"),
            Map.entry("japanese", "ja"),
            Map.entry("korean", "ko"),
            Map.entry("french", "fr"),
            Map.entry("german", "de"),
            Map.entry("spanish", "es"));

    public String normalizeSource(String language) {
        return normalize(language, DEFAULT_SOURCE);
    }

    /**
     * @throws IllegalArgumentException if {@code language} asks for auto-detection.
     */
    public String normalizeTarget(String language) {
        String normalized = normalize(language, DEFAULT_TARGET);
        if (AUTO_DETECT.equals(normalized)) {
            throw new IllegalArgumentException("Target language cannot be 'auto'.");
        }
        return normalized;
    }

    private static String normalize(String language, String fallback) {
        if (!StringUtils.hasText(language)) {
            return fallback;
        }
        String key = language.trim().toLowerCase(Locale.ROOT);
        return ALIASES.getOrDefault(key, key);
    }
}
