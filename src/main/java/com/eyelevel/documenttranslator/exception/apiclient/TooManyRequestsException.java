package com.eyelevel.documenttranslator.exception.apiclient;

import java.io.Serial;

/**
 * The remote service is throttling this client (HTTP 429).
 */
public class TooManyRequestsException extends ApiException {

    @Serial
    private static final long serialVersionUID = -6576126133407459351L;

    public TooManyRequestsException(String message) {
        super(message, 429);
    }
}
