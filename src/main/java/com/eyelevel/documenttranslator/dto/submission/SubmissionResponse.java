package com.eyelevel.documenttranslator.dto.submission;

import com.eyelevel.documenttranslator.model.JobStatus;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SubmissionResponse {
    private String jobId;
    private JobStatus status;
    private int totalPages;
    /**
     * Human-readable duration estimate, e.g. {@code "3 minutes"}.
     */
    private String estimatedTime;
}
