package com.eyelevel.documenttranslator.service.submission;

import com.eyelevel.documenttranslator.config.DocumentTranslationConfig;
import com.eyelevel.documenttranslator.service.extraction.factory.DocumentExtractorFactory;
import com.eyelevel.documenttranslator.service.extraction.impl.PlainTextDocumentExtractor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProcessingEstimatorTest {

    private final ProcessingEstimator estimator = new ProcessingEstimator(
            new DocumentExtractorFactory(List.of(new PlainTextDocumentExtractor())), new DocumentTranslationConfig());

    @TempDir
    Path tempDir;

    @Test
    void testEstimatePages_CountsPagesWhenExtractorCan() throws IOException {
        // Given
        Path file = Files.writeString(tempDir.resolve("a.txt"), "one\ftwo\fthree");

        // When / Then
        assertThat(estimator.estimatePages(file, "txt", Files.size(file))).isEqualTo(3);
    }

    @Test
    void testEstimatePages_FallsBackToSizeAndCaps() {
        Path unread = tempDir.resolve("a.docx");

        assertThat(estimator.estimatePages(unread, "docx", 30 * 1024)).isEqualTo(10);
        assertThat(estimator.estimatePages(unread, "docx", 100)).isEqualTo(1);
        assertThat(estimator.estimatePages(unread, "docx", 100L * 1024 * 1024)).isEqualTo(500);
    }

    @Test
    void testEstimateDuration_PerFileType() {
        assertThat(estimator.estimateDuration("pdf", 3, 1000)).isEqualTo("2 minutes");
        assertThat(estimator.estimateDuration("pdf", 26, 1000)).isEqualTo("6 minutes");
        assertThat(estimator.estimateDuration("docx", 50, 1000)).isEqualTo("5 minutes");
        assertThat(estimator.estimateDuration("txt", 1, 1000)).isEqualTo("1 minute");
    }
}
