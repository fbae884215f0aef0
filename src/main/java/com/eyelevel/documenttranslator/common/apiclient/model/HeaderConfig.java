package com.eyelevel.documenttranslator.common.apiclient.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Static headers sent with every request of one API client, e.g. a fixed {@code User-Agent}.
 */
@Getter
@Setter
public class HeaderConfig {

    private List<Header> headers = new ArrayList<>();

    public HeaderConfig add(String name, String value) {
        headers.add(new Header(name, value));
        return this;
    }

    /**
     * Represents a single header with a name and a value.
     */
    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Header {

        private String name;
        private String value;
    }
}
