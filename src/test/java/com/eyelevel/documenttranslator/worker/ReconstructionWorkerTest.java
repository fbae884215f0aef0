package com.eyelevel.documenttranslator.worker;

import com.eyelevel.documenttranslator.model.artifact.TranslatedChunk;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReconstructionWorkerTest {

    @Test
    void testAssemble_OrdersPagesAndChunks() {
        // Given
        List<TranslatedChunk> chunks = List.of(
                new TranslatedChunk(2, 1, "d", "D"),
                new TranslatedChunk(1, 0, "a", "A"),
                new TranslatedChunk(2, 0, "c", "C"),
                new TranslatedChunk(1, 1, "b", "B"));

        // When
        String document = ReconstructionWorker.assemble(chunks);

        // Then
        assertThat(document).isEqualTo("""
                ==================== Page 1 ====================
                A

                B

                ==================== Page 2 ====================
                C

                D""");
    }

    @Test
    void testAssemble_SkipsPagesWithoutChunks() {
        // Given
        List<TranslatedChunk> chunks = List.of(new TranslatedChunk(3, 0, "x", "X"));

        // When
        String document = ReconstructionWorker.assemble(chunks);

        // Then
        assertThat(document).isEqualTo(ReconstructionWorker.pageDelimiter(3) + "\nX");
    }
}
