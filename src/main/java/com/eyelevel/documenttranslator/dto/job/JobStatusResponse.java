package com.eyelevel.documenttranslator.dto.job;

import com.eyelevel.documenttranslator.model.JobStatus;
import com.eyelevel.documenttranslator.model.TranslationJob;
import com.eyelevel.documenttranslator.model.TranslationTier;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Client view of a translation job. Storage paths are not exposed; {@code outputAvailable} tells the
 * client whether the download endpoint will serve a result.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatusResponse {
    private String jobId;
    private String originalFilename;
    private JobStatus status;
    private double progress;
    private int totalPages;
    private int processedPages;
    private String sourceLang;
    private String targetLang;
    private TranslationTier tier;
    private Instant createdAt;
    private Instant updatedAt;
    private String error;
    private boolean outputAvailable;

    public static JobStatusResponse from(TranslationJob job) {
        return JobStatusResponse.builder()
                .jobId(job.getJobId())
                .originalFilename(job.getOriginalFilename())
                .status(job.getStatus())
                .progress(job.getProgress())
                .totalPages(job.getTotalPages())
                .processedPages(job.getProcessedPages())
                .sourceLang(job.getSourceLang())
                .targetLang(job.getTargetLang())
                .tier(job.getTier())
                .createdAt(job.getCreatedAt())
                .updatedAt(job.getUpdatedAt())
                .error(job.getError())
                .outputAvailable(job.getStatus() == JobStatus.COMPLETED && job.getFinalOutput() != null)
                .build();
    }
}
