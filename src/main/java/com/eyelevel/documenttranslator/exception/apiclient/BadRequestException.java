package com.eyelevel.documenttranslator.exception.apiclient;

import java.io.Serial;

/**
 * The remote service rejected the request as malformed (HTTP 400).
 */
public class BadRequestException extends ApiException {

    @Serial
    private static final long serialVersionUID = 3318200435128844817L;

    public BadRequestException(String message) {
        super(message, 400);
    }
}
