package com.eyelevel.documenttranslator.service.submission;

import com.eyelevel.documenttranslator.config.DocumentTranslationConfig;
import com.eyelevel.documenttranslator.service.extraction.factory.DocumentExtractorFactory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Rough page and duration estimates shown to the client at submission time. Extraction replaces the
 * page estimate with the real count.
 */
@Component
@RequiredArgsConstructor
public class ProcessingEstimator {

    private static final double BYTES_PER_MEGABYTE = 1024.0 * 1024.0;

    private final DocumentExtractorFactory extractorFactory;
    private final DocumentTranslationConfig documentTranslationConfig;

    /**
     * PDF and plain text are counted from the file. Word documents, whose layout decides pagination,
     * are estimated from their size.
     */
    public int estimatePages(Path file, String extension, long sizeBytes) {
        int counted = extractorFactory.getExtractor(extension).map(e -> e.countPages(file)).orElse(-1);
        if (counted > 0) {
            return counted;
        }
        DocumentTranslationConfig.Estimation estimation = documentTranslationConfig.getEstimation();
        long pages = (sizeBytes / 1024) / Math.max(1, estimation.getWordKilobytesPerPage());
        return (int) Math.max(1, Math.min(estimation.getMaxWordPages(), pages));
    }

    public String estimateDuration(String extension, int pages, long sizeBytes) {
        double minutes = switch (extension) {
            case "pdf" -> Math.max(2, pages * 0.2);
            case "doc", "docx" -> Math.max(2, pages * 0.1);
            default -> Math.max(1, (sizeBytes / BYTES_PER_MEGABYTE) * 0.5);
        };
        long rounded = (long) Math.ceil(minutes);
        return rounded == 1 ? "1 minute" : rounded + " minutes";
    }
}
