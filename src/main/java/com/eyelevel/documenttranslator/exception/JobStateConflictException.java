package com.eyelevel.documenttranslator.exception;

import java.io.Serial;

/**
 * Raised when an operation is not allowed in the job's current status, e.g. cancelling a completed job.
 */
public class JobStateConflictException extends DocumentTranslationException {
    @Serial
    private static final long serialVersionUID = 3963112275409883526L;

    public JobStateConflictException(String message) {
        super(message);
    }
}
