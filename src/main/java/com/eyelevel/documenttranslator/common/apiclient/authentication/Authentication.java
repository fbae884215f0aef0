package com.eyelevel.documenttranslator.common.apiclient.authentication;

import java.util.Map;

/**
 * Adds a provider's credentials to an outgoing request.
 */
@FunctionalInterface
public interface Authentication {

    /**
     * For public endpoints such as the keyless Google Translate API.
     */
    Authentication NONE = headers -> {
    };

    /**
     * @param headers Mutable request headers. Implementations add or replace their own entries.
     */
    void applyAuthentication(Map<String, String> headers);
}
