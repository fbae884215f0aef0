package com.eyelevel.documenttranslator.dto.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

/**
 * A standardized, generic wrapper for all API responses.
 * It provides a consistent structure for both successful and failed responses,
 * making it easy for clients to handle them.
 **/
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    /**
     * A message to display to the user.
     */
    private final String displayMessage;

    /**
     * The response data.
     */
    private final T response;

    /**
     * A flag indicating whether to show the display message.
     */
    private final Boolean showMessage;

    /**
     * The HTTP status code of the response.
     */
    private final Integer statusCode;

    public static <T> ApiResponse<T> error(String displayMessage) {
        return ApiResponse.<T>builder()
                .displayMessage(displayMessage)
                .showMessage(true)
                .build();
    }

    /**
     * @param detail Technical detail for the client, carried as the response body.
     */
    @SuppressWarnings("unchecked")
    public static <T> ApiResponse<T> error(String displayMessage, String detail) {
        return ApiResponse.<T>builder()
                .displayMessage(displayMessage)
                .response((T) detail)
                .showMessage(true)
                .build();
    }
}
