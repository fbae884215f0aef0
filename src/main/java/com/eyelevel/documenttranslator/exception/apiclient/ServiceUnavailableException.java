package com.eyelevel.documenttranslator.exception.apiclient;

import java.io.Serial;

/**
 * The remote service could not be reached or reported itself unavailable (HTTP 503).
 */
public class ServiceUnavailableException extends ApiException {

    @Serial
    private static final long serialVersionUID = -2812514621225838422L;

    public ServiceUnavailableException(String message) {
        super(message, 503);
    }
}
