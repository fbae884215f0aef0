package com.eyelevel.documenttranslator.service.extraction.impl;

import com.eyelevel.documenttranslator.exception.ExtractionException;
import com.eyelevel.documenttranslator.model.artifact.ExtractedPage;
import com.eyelevel.documenttranslator.model.artifact.ExtractionResult;
import com.eyelevel.documenttranslator.service.extraction.DocumentExtractor;
import com.eyelevel.documenttranslator.service.extraction.ExtractionProgressListener;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.hwpf.HWPFDocument;
import org.apache.poi.hwpf.extractor.WordExtractor;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTBr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STBrType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Extracts Word documents with Apache POI. Pages follow explicit page breaks only, since Word's
 * layout-dependent pagination is not stored in the file; a document without breaks is a single page.
 */
@Slf4j
@Component
public class WordDocumentExtractor implements DocumentExtractor {

    @Override
    public boolean supports(String extension) {
        return "docx".equals(extension) || "doc".equals(extension);
    }

    @Override
    public ExtractionResult extract(Path source, ExtractionProgressListener listener) {
        String fileName = source.getFileName().toString().toLowerCase(Locale.ROOT);
        List<String> rawPages;
        try {
            rawPages = fileName.endsWith(".doc") ? extractLegacy(source) : extractOoxml(source);
        } catch (IOException | RuntimeException e) {
            throw new ExtractionException("Failed to read Word document " + source.getFileName() + ": "
                    + e.getMessage(), e);
        }

        int totalPages = rawPages.size();
        List<ExtractedPage> pages = new ArrayList<>(totalPages);
        for (int i = 0; i < totalPages; i++) {
            pages.add(new ExtractedPage(i + 1, rawPages.get(i).strip()));
            listener.onPageExtracted(i + 1, totalPages);
        }
        log.debug("Extracted {} page(s) from Word document '{}'.", totalPages, source.getFileName());
        return new ExtractionResult(pages, totalPages);
    }

    private List<String> extractOoxml(Path source) throws IOException {
        List<String> pages = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        try (InputStream in = Files.newInputStream(source); XWPFDocument document = new XWPFDocument(in)) {
            for (IBodyElement element : document.getBodyElements()) {
                if (element instanceof XWPFParagraph paragraph) {
                    if (paragraph.isPageBreak() && current.length() > 0) {
                        pages.add(current.toString());
                        current.setLength(0);
                    }
                    current.append(paragraph.getText()).append('\n');
                    if (endsWithPageBreak(paragraph)) {
                        pages.add(current.toString());
                        current.setLength(0);
                    }
                } else if (element instanceof XWPFTable table) {
                    current.append(table.getText()).append('\n');
                }
            }
        }
        if (current.length() > 0 || pages.isEmpty()) {
            pages.add(current.toString());
        }
        return pages;
    }

    private static boolean endsWithPageBreak(XWPFParagraph paragraph) {
        for (XWPFRun run : paragraph.getRuns()) {
            for (CTBr br : run.getCTR().getBrList()) {
                if (br.getType() == STBrType.PAGE) {
                    return true;
                }
            }
        }
        return false;
    }

    private List<String> extractLegacy(Path source) throws IOException {
        try (InputStream in = Files.newInputStream(source);
             HWPFDocument document = new HWPFDocument(in);
             WordExtractor extractor = new WordExtractor(document)) {
            // Word 97-2003 stores hard page breaks as form feeds in the text stream.
            return List.of(extractor.getText().split("\f", -1));
        }
    }
}
