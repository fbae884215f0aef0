package com.eyelevel.documenttranslator.dto.queue;

import com.eyelevel.documenttranslator.model.JobStatus;
import com.eyelevel.documenttranslator.model.TranslationJob;

public record ActiveJobSummary(String jobId, JobStatus status, double progress, int totalPages) {

    public static ActiveJobSummary from(TranslationJob job) {
        return new ActiveJobSummary(job.getJobId(), job.getStatus(), job.getProgress(), job.getTotalPages());
    }
}
