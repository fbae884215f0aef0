package com.eyelevel.documenttranslator.exception;

import java.io.Serial;

/**
 * A base exception for errors raised by the translation pipeline and its submission path.
 */
public class DocumentTranslationException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 4656352395708234308L;

    public DocumentTranslationException(String message) {
        super(message);
    }

    public DocumentTranslationException(String message, Throwable cause) {
        super(message, cause);
    }
}
