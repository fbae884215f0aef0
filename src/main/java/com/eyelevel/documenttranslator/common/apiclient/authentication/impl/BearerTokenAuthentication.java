package com.eyelevel.documenttranslator.common.apiclient.authentication.impl;

import com.eyelevel.documenttranslator.common.apiclient.authentication.Authentication;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;

import java.util.Map;

/**
 * Sends a static token in the {@code Authorization: Bearer} header, as the OpenAI API expects.
 */
@Slf4j
public record BearerTokenAuthentication(String token) implements Authentication {

    @Override
    public void applyAuthentication(Map<String, String> headers) {
        if (headers == null) {
            log.error("Header map cannot be null when applying bearer token authentication.");
            return;
        }
        headers.put(HttpHeaders.AUTHORIZATION, "Bearer " + token);
    }

    @Override
    public String toString() {
        return "BearerTokenAuthentication[token=****]";
    }
}
