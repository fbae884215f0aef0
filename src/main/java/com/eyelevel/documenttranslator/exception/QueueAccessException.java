package com.eyelevel.documenttranslator.exception;

import java.io.Serial;

/**
 * Raised when a stage queue cannot be reached for push, pop or inspection.
 */
public class QueueAccessException extends DocumentTranslationException {
    @Serial
    private static final long serialVersionUID = 8154468122053671032L;

    public QueueAccessException(String message) {
        super(message);
    }

    public QueueAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
