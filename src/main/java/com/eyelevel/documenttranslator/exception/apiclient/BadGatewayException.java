package com.eyelevel.documenttranslator.exception.apiclient;

import java.io.Serial;

/**
 * The remote service answered with an invalid upstream response (HTTP 502).
 */
public class BadGatewayException extends ApiException {

    @Serial
    private static final long serialVersionUID = 6702374416280935129L;

    public BadGatewayException(String message) {
        super(message, 502);
    }
}
