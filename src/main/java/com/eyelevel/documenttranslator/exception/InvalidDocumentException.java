package com.eyelevel.documenttranslator.exception;

import java.io.Serial;

/**
 * Raised when an upload is empty, unnamed or otherwise unusable before a job is created.
 */
public class InvalidDocumentException extends DocumentTranslationException {
    @Serial
    private static final long serialVersionUID = 7735049262173392188L;

    public InvalidDocumentException(String message) {
        super(message);
    }
}
