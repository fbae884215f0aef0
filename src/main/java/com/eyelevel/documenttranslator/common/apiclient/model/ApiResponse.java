package com.eyelevel.documenttranslator.common.apiclient.model;

import lombok.Builder;
import lombok.Getter;

/**
 * Raw body of a successful provider call. Parsing is left to the client that made the call.
 */
@Builder
@Getter
public class ApiResponse {

    private final byte[] data;

    private final int statusCode;

    private final long elapsedMillis;
}
