package com.eyelevel.documenttranslator.service.notification;

import com.eyelevel.documenttranslator.model.TranslationJob;

/**
 * Hook that tells an external task-execution facility (autoscaler, monitoring consumer) that a job was created.
 * Delivery is best effort: the job is already durably enqueued before this is called, so a failure here never
 * affects pipeline progress.
 */
public interface TaskExecutionNotifier {

    void jobCreated(TranslationJob job);
}
