package com.eyelevel.documenttranslator.exception.apiclient;

import java.io.Serial;

/**
 * The remote service rejected the configured credentials (HTTP 401 or 403).
 */
public class UnauthorizedException extends ApiException {

    @Serial
    private static final long serialVersionUID = -1849925371026519010L;

    public UnauthorizedException(String message) {
        super(message, 401);
    }
}
