package com.eyelevel.documenttranslator.exception;

import java.io.Serial;

/**
 * Raised by the job store when a write carries a revision older than the stored record.
 * Callers re-read the record and re-apply their change.
 */
public class StaleJobRevisionException extends DocumentTranslationException {
    @Serial
    private static final long serialVersionUID = -260891437724126834L;

    public StaleJobRevisionException(String message) {
        super(message);
    }

    public StaleJobRevisionException(String message, Throwable cause) {
        super(message, cause);
    }
}
