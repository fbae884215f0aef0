package com.eyelevel.documenttranslator.exception.apiclient;

import java.io.Serial;

/**
 * The remote call did not complete within the client timeout (HTTP 504).
 */
public class GatewayTimeoutException extends ApiException {

    @Serial
    private static final long serialVersionUID = 2250896183645260418L;

    public GatewayTimeoutException(String message) {
        super(message, 504);
    }
}
