package com.eyelevel.documenttranslator.exception;

import java.io.Serial;

/**
 * Raised when an upload exceeds the configured maximum file size.
 */
public class FileTooLargeException extends DocumentTranslationException {
    @Serial
    private static final long serialVersionUID = 1902368470751355047L;

    public FileTooLargeException(String message) {
        super(message);
    }
}
