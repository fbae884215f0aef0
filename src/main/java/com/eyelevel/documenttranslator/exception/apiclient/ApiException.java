package com.eyelevel.documenttranslator.exception.apiclient;

import lombok.Getter;

import java.io.Serial;

/**
 * Base class for failures raised while calling an external HTTP service, such as a translation provider.
 *
 * <p>Carries the HTTP status code returned by the remote service, or a synthetic 5xx code when the
 * call never produced a response.
 */
@Getter
public class ApiException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 4830840555831897529L;
    private final int statusCode;

    /**
     * Constructs a new ApiException with the specified message and status code.
     *
     * @param message    A descriptive message about the exception.
     * @param statusCode The HTTP status code associated with the exception.
     */
    public ApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /**
     * Whether the failure is worth another attempt: throttling, server errors and transport failures.
     *
     * @return true for 429 and any 5xx status.
     */
    public boolean isRetryable() {
        return statusCode == 429 || statusCode >= 500;
    }
}
