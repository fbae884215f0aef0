package com.eyelevel.documenttranslator.service.extraction.impl;

import com.eyelevel.documenttranslator.exception.ExtractionException;
import com.eyelevel.documenttranslator.model.artifact.ExtractionResult;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PdfDocumentExtractorTest {

    private final PdfDocumentExtractor extractor = new PdfDocumentExtractor();

    @TempDir
    Path tempDir;

    @Test
    void testExtract_ReadsEachPageAndKeepsBlankPages() throws IOException {
        // Given
        Path file = tempDir.resolve("sample.pdf");
        try (PDDocument document = new PDDocument()) {
            addPage(document, "Hello from page one");
            document.addPage(new PDPage());
            addPage(document, "Goodbye from page three");
            document.save(file.toFile());
        }
        AtomicInteger lastReported = new AtomicInteger();

        // When
        ExtractionResult result = extractor.extract(file, (done, total) -> lastReported.set(done));

        // Then
        assertThat(result.totalPages()).isEqualTo(3);
        assertThat(result.pages().get(0).text()).isEqualTo("Hello from page one");
        assertThat(result.pages().get(1).hasText()).isFalse();
        assertThat(result.pages().get(2).text()).isEqualTo("Goodbye from page three");
        assertThat(lastReported.get()).isEqualTo(3);
        assertThat(extractor.countPages(file)).isEqualTo(3);
    }

    @Test
    void testExtract_NotAPdfThrows() throws IOException {
        // Given
        Path file = Files.writeString(tempDir.resolve("fake.pdf"), "plain text pretending to be a PDF");

        // When / Then
        assertThatThrownBy(() -> extractor.extract(file, (done, total) -> { }))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("fake.pdf");
        assertThat(extractor.countPages(file)).isEqualTo(-1);
    }

    private static void addPage(PDDocument document, String text) throws IOException {
        PDPage page = new PDPage();
        document.addPage(page);
        try (PDPageContentStream content = new PDPageContentStream(document, page)) {
            content.beginText();
            content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
            content.newLineAtOffset(72, 700);
            content.showText(text);
            content.endText();
        }
    }
}
