package com.eyelevel.documenttranslator.service.extraction.impl;

import com.eyelevel.documenttranslator.exception.ExtractionException;
import com.eyelevel.documenttranslator.model.artifact.ExtractedPage;
import com.eyelevel.documenttranslator.model.artifact.ExtractionResult;
import com.eyelevel.documenttranslator.service.extraction.DocumentExtractor;
import com.eyelevel.documenttranslator.service.extraction.ExtractionProgressListener;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts text from PDFs page by page with PDFBox. Scanned pages without a text layer come back empty;
 * OCR is not attempted.
 */
@Slf4j
@Component
public class PdfDocumentExtractor implements DocumentExtractor {

    @Override
    public boolean supports(String extension) {
        return "pdf".equals(extension);
    }

    @Override
    public ExtractionResult extract(Path source, ExtractionProgressListener listener) {
        try (PDDocument document = Loader.loadPDF(source.toFile())) {
            int totalPages = document.getNumberOfPages();
            log.debug("PDF '{}' has {} page(s).", source.getFileName(), totalPages);

            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            List<ExtractedPage> pages = new ArrayList<>(totalPages);
            for (int pageNumber = 1; pageNumber <= totalPages; pageNumber++) {
                stripper.setStartPage(pageNumber);
                stripper.setEndPage(pageNumber);
                pages.add(new ExtractedPage(pageNumber, stripper.getText(document).strip()));
                listener.onPageExtracted(pageNumber, totalPages);
            }
            return new ExtractionResult(pages, totalPages);
        } catch (InvalidPasswordException e) {
            throw new ExtractionException("PDF " + source.getFileName() + " is password protected", e);
        } catch (IOException e) {
            throw new ExtractionException("Failed to read PDF " + source.getFileName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public int countPages(Path source) {
        try (PDDocument document = Loader.loadPDF(source.toFile())) {
            return document.getNumberOfPages();
        } catch (IOException e) {
            log.warn("Could not count pages of PDF '{}': {}", source.getFileName(), e.getMessage());
            return -1;
        }
    }
}
