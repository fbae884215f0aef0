package com.eyelevel.documenttranslator.service.extraction;

import com.eyelevel.documenttranslator.exception.ExtractionException;
import com.eyelevel.documenttranslator.model.artifact.ExtractionResult;

import java.nio.file.Path;

/**
 * Reads per-page text out of a source document. One implementation per family of file types,
 * selected by {@link com.eyelevel.documenttranslator.service.extraction.factory.DocumentExtractorFactory}.
 */
public interface DocumentExtractor {

    /**
     * @param extension lower-case file extension without the dot, e.g. {@code "pdf"}.
     */
    boolean supports(String extension);

    /**
     * Extracts the text of every page.
     *
     * @param source   the stored upload.
     * @param listener notified after each page so the caller can report progress.
     * @return the pages in ascending order; pages without text are kept with empty text.
     * @throws ExtractionException if the document cannot be read.
     */
    ExtractionResult extract(Path source, ExtractionProgressListener listener);

    /**
     * Counts pages cheaply, for estimates made at submission time.
     *
     * @return the page count, or -1 if this extractor cannot tell without a full extraction.
     */
    default int countPages(Path source) {
        return -1;
    }
}
