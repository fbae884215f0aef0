package com.eyelevel.documenttranslator.exception;

import java.io.Serial;

/**
 * Raised when a translation provider returns an unusable result or fails after its retries.
 */
public class TranslationProviderException extends DocumentTranslationException {
    @Serial
    private static final long serialVersionUID = 5506712049365927046L;

    public TranslationProviderException(String message) {
        super(message);
    }

    public TranslationProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
