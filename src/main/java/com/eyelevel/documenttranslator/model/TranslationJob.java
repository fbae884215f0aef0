package com.eyelevel.documenttranslator.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * The persisted record of one document translation request, tracked end to end by the pipeline.
 * <p>
 * Optional artifact references and {@code error} are nullable columns; SQL NULL is the "absent"
 * marker and stays distinct from an empty string. {@code revision} is the optimistic concurrency
 * token: every write increments it and a write carrying an older value is rejected.
 */
@Entity
@Table(name = "translation_job")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TranslationJob {

    @Id
    @Column(length = 36, updatable = false)
    private String jobId;

    @Column(nullable = false, updatable = false, length = 1024)
    private String sourcePath;

    @Column
    private String originalFilename;

    @Column(nullable = false, updatable = false, length = 16)
    private String sourceLang;

    @Column(nullable = false, updatable = false, length = 16)
    private String targetLang;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private TranslationTier tier;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private JobStatus status;

    @Column(nullable = false)
    private double progress;

    @Column(nullable = false)
    private int totalPages;

    @Column(nullable = false)
    private int processedPages;

    @Column(length = 1024)
    private String extractionOutput;

    @Column(length = 1024)
    private String translationOutput;

    @Column(length = 1024)
    private String finalOutput;

    @Column(columnDefinition = "TEXT")
    private String error;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @Version
    private Long revision;

    @Transient
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
