package com.eyelevel.documenttranslator.exception;

import java.io.Serial;

public class UnsupportedFileTypeException extends DocumentTranslationException {
    @Serial
    private static final long serialVersionUID = -4146823766536414925L;

    public UnsupportedFileTypeException(String message) {
        super(message);
    }
}
