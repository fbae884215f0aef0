package com.eyelevel.documenttranslator.service.extraction.impl;

import com.eyelevel.documenttranslator.exception.ExtractionException;
import com.eyelevel.documenttranslator.model.artifact.ExtractedPage;
import com.eyelevel.documenttranslator.model.artifact.ExtractionResult;
import com.eyelevel.documenttranslator.service.extraction.ExtractionProgressListener;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlainTextDocumentExtractorTest {

    private final PlainTextDocumentExtractor extractor = new PlainTextDocumentExtractor();

    @TempDir
    Path tempDir;

    @Test
    void testExtract_FormFeedSeparatesPages() throws IOException {
        // Given
        Path file = Files.writeString(tempDir.resolve("doc.txt"), "Page one.\n\fPage two.\f  Page three. ",
                StandardCharsets.UTF_8);
        List<Integer> reported = new ArrayList<>();

        // When
        ExtractionResult result = extractor.extract(file, (done, total) -> reported.add(done));

        // Then
        assertThat(result.totalPages()).isEqualTo(3);
        assertThat(result.pages()).extracting(ExtractedPage::text)
                .containsExactly("Page one.", "Page two.", "Page three.");
        assertThat(result.pages()).extracting(ExtractedPage::pageNumber).containsExactly(1, 2, 3);
        assertThat(reported).containsExactly(1, 2, 3);
        assertThat(extractor.countPages(file)).isEqualTo(3);
    }

    @Test
    void testExtract_WhitespaceOnlyFileHasNoText() throws IOException {
        // Given
        Path file = Files.writeString(tempDir.resolve("blank.txt"), "  \n\n ", StandardCharsets.UTF_8);

        // When
        ExtractionResult result = extractor.extract(file, ExtractionProgressListener.NONE);

        // Then
        assertThat(result.totalPages()).isEqualTo(1);
        assertThat(result.hasText()).isFalse();
    }

    @Test
    void testExtract_MissingFileThrows() {
        assertThatThrownBy(() -> extractor.extract(tempDir.resolve("gone.txt"), ExtractionProgressListener.NONE))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("gone.txt");
    }
}
