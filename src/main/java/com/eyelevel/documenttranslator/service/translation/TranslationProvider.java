package com.eyelevel.documenttranslator.service.translation;

import com.eyelevel.documenttranslator.model.TranslationTier;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates text between two languages. Implementations own their timeouts; a timeout surfaces as an
 * exception like any other provider failure.
 */
public interface TranslationProvider {

    /**
     * @return short provider name used in logs.
     */
    String name();

    /**
     * @param sourceLang source language code, or {@code auto} to let the provider detect it.
     */
    String translate(String text, String sourceLang, String targetLang, TranslationTier tier);

    /**
     * Translates several texts, returning results in input order. The default sends one call per text.
     */
    default List<String> translateBatch(List<String> texts, String sourceLang, String targetLang,
                                        TranslationTier tier) {
        List<String> translated = new ArrayList<>(texts.size());
        for (String text : texts) {
            translated.add(translate(text, sourceLang, targetLang, tier));
        }
        return translated;
    }
}
