package com.eyelevel.documenttranslator.service.submission;

import com.eyelevel.documenttranslator.dto.submission.SubmissionResponse;
import com.eyelevel.documenttranslator.exception.ArtifactStorageException;
import com.eyelevel.documenttranslator.exception.InvalidDocumentException;
import com.eyelevel.documenttranslator.model.TranslationJob;
import com.eyelevel.documenttranslator.model.TranslationTier;
import com.eyelevel.documenttranslator.service.job.JobQueueManager;
import com.eyelevel.documenttranslator.service.storage.LocalArtifactStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Accepts an uploaded document, stores it and creates its translation job.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentSubmissionService {

    private final DocumentValidationService documentValidationService;
    private final LanguageNormalizer languageNormalizer;
    private final ProcessingEstimator processingEstimator;
    private final LocalArtifactStorage artifactStorage;
    private final JobQueueManager jobQueueManager;

    /**
     * Validates the upload and its options, stores the file and enqueues a new job for extraction.
     *
     * @param tier Tier name; blank means {@code standard}.
     * @return The new job's id, initial status and estimates.
     * @throws InvalidDocumentException if a language or tier value is not acceptable, or the file is invalid.
     */
    public SubmissionResponse submit(final MultipartFile file, final String sourceLang, final String targetLang,
                                     final String tier) {
        final String extension = documentValidationService.validate(file.getOriginalFilename(), file.getSize());
        final TranslationTier translationTier = parseTier(tier);
        final String source;
        final String target;
        try {
            source = languageNormalizer.normalizeSource(sourceLang);
            target = languageNormalizer.normalizeTarget(targetLang);
        } catch (IllegalArgumentException e) {
            throw new InvalidDocumentException(e.getMessage());
        }

        final Path stored;
        try (InputStream content = file.getInputStream()) {
            stored = artifactStorage.storeUpload(content, extension);
        } catch (IOException e) {
            throw new ArtifactStorageException("Failed to read upload: " + e.getMessage(), e);
        }

        final int pages = processingEstimator.estimatePages(stored, extension, file.getSize());
        final String estimatedTime = processingEstimator.estimateDuration(extension, pages, file.getSize());
        log.info("Accepted '{}' ({}, ~{} pages) for translation {} -> {} at tier {}.", file.getOriginalFilename(),
                FileUtils.byteCountToDisplaySize(file.getSize()), pages, source, target, translationTier.getValue());

        final TranslationJob job = jobQueueManager.createJob(stored.toString(), source, target, translationTier, pages,
                file.getOriginalFilename());

        return SubmissionResponse.builder()
                .jobId(job.getJobId())
                .status(job.getStatus())
                .totalPages(job.getTotalPages())
                .estimatedTime(estimatedTime)
                .build();
    }

    private static TranslationTier parseTier(final String tier) {
        if (!StringUtils.hasText(tier)) {
            return TranslationTier.STANDARD;
        }
        try {
            return TranslationTier.fromValue(tier.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidDocumentException(e.getMessage());
        }
    }
}
