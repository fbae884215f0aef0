package com.eyelevel.documenttranslator.exception;

import java.io.Serial;

/**
 * Raised when a job id has no record in the job store.
 */
public class JobNotFoundException extends DocumentTranslationException {
    @Serial
    private static final long serialVersionUID = -5150321693214405271L;

    public JobNotFoundException(String message) {
        super(message);
    }
}
