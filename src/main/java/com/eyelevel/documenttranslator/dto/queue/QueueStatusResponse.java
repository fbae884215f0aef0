package com.eyelevel.documenttranslator.dto.queue;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Pending entries per stage queue plus the most recently created non-terminal jobs.
 */
@Data
@Builder
public class QueueStatusResponse {
    /**
     * Keyed by stage name: extraction, chunking, translation, reconstruction.
     */
    private Map<String, Long> queues;
    private List<ActiveJobSummary> activeJobs;
    private int totalActive;
}
