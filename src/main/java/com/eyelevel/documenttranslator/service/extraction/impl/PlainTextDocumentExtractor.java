package com.eyelevel.documenttranslator.service.extraction.impl;

import com.eyelevel.documenttranslator.exception.ExtractionException;
import com.eyelevel.documenttranslator.model.artifact.ExtractedPage;
import com.eyelevel.documenttranslator.model.artifact.ExtractionResult;
import com.eyelevel.documenttranslator.service.extraction.DocumentExtractor;
import com.eyelevel.documenttranslator.service.extraction.ExtractionProgressListener;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts UTF-8 text files. A form feed character marks a page break; a file without one is a single page.
 */
@Slf4j
@Component
public class PlainTextDocumentExtractor implements DocumentExtractor {

    static final String PAGE_BREAK = "\f";

    @Override
    public boolean supports(String extension) {
        return "txt".equals(extension);
    }

    @Override
    public ExtractionResult extract(Path source, ExtractionProgressListener listener) {
        String content = read(source);
        String[] rawPages = content.split(PAGE_BREAK, -1);
        int totalPages = rawPages.length;

        List<ExtractedPage> pages = new ArrayList<>(totalPages);
        for (int i = 0; i < totalPages; i++) {
            pages.add(new ExtractedPage(i + 1, rawPages[i].strip()));
            listener.onPageExtracted(i + 1, totalPages);
        }
        log.debug("Extracted {} page(s) from text file '{}'.", totalPages, source.getFileName());
        return new ExtractionResult(pages, totalPages);
    }

    @Override
    public int countPages(Path source) {
        return read(source).split(PAGE_BREAK, -1).length;
    }

    private static String read(Path source) {
        try {
            return FileUtils.readFileToString(source.toFile(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ExtractionException("Failed to read text file " + source.getFileName() + ": " + e.getMessage(), e);
        }
    }
}
