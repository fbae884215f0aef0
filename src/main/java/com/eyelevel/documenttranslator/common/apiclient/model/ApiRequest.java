package com.eyelevel.documenttranslator.common.apiclient.model;

import lombok.Builder;
import lombok.Data;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One call to a translation provider's HTTP API.
 */
@Builder
@Data
public class ApiRequest {

    /**
     * Short label for logs, e.g. {@code "google.translate"}.
     */
    private final String operation;

    private final HttpMethod method;

    /**
     * Path relative to the client's base URL.
     */
    private final String path;

    /**
     * A parameter may repeat, as in Google's {@code dt=t&dt=bd}.
     */
    @Nullable
    private final Map<String, List<Object>> queryParams;

    private final Map<String, String> headers = new HashMap<>();

    @Nullable
    private final Object body;

    @Nullable
    private final MediaType acceptMediaType;

    @Nullable
    private final MediaType contentType;
}
