package com.eyelevel.documenttranslator.service.extraction.factory;

import com.eyelevel.documenttranslator.service.extraction.DocumentExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * A factory for retrieving the {@link DocumentExtractor} for a given file extension.
 */
@Service
@Slf4j
public class DocumentExtractorFactory {

    private final List<DocumentExtractor> extractors;

    public DocumentExtractorFactory(List<DocumentExtractor> extractors) {
        this.extractors = extractors;
        log.info("DocumentExtractorFactory initialized with {} available extractors.", extractors.size());
    }

    /**
     * @param extension The file extension, with or without a leading dot, in any case.
     * @return The first extractor that supports the extension, or empty if none does.
     */
    public Optional<DocumentExtractor> getExtractor(String extension) {
        if (extension == null) {
            return Optional.empty();
        }
        String normalized = extension.toLowerCase(Locale.ROOT);
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        final String key = normalized;
        Optional<DocumentExtractor> extractor = extractors.stream().filter(e -> e.supports(key)).findFirst();
        log.debug("Searching for extractor for extension '{}'. Found: {}", key,
                extractor.map(e -> e.getClass().getSimpleName()).orElse("None"));
        return extractor;
    }
}
