package com.eyelevel.documenttranslator.common.apiclient;

import com.eyelevel.documenttranslator.common.apiclient.authentication.Authentication;
import com.eyelevel.documenttranslator.common.apiclient.model.ApiRequest;
import com.eyelevel.documenttranslator.common.apiclient.model.ApiResponse;
import com.eyelevel.documenttranslator.common.apiclient.model.HeaderConfig;
import com.eyelevel.documenttranslator.exception.apiclient.ApiException;
import com.eyelevel.documenttranslator.exception.apiclient.BadGatewayException;
import com.eyelevel.documenttranslator.exception.apiclient.BadRequestException;
import com.eyelevel.documenttranslator.exception.apiclient.GatewayTimeoutException;
import com.eyelevel.documenttranslator.exception.apiclient.ServiceUnavailableException;
import com.eyelevel.documenttranslator.exception.apiclient.TooManyRequestsException;
import com.eyelevel.documenttranslator.exception.apiclient.UnauthorizedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Abstract base class for clients of external HTTP services such as translation providers. It sends a
 * blocking request through the configured {@link WebClient}, applies {@link Authentication} and
 * {@link HeaderConfig}, enforces a timeout, and maps every failure onto the {@link ApiException} family
 * so callers can decide on retries from the status code alone.
 */
@Slf4j
public abstract class ApiClient {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    protected final WebClient webClient;
    protected final Authentication authentication;
    protected final HeaderConfig headerConfig;
    private final Duration timeout;

    protected ApiClient(WebClient webClient, Authentication authentication, HeaderConfig headerConfig) {
        this(webClient, authentication, headerConfig, DEFAULT_TIMEOUT);
    }

    protected ApiClient(WebClient webClient, Authentication authentication, HeaderConfig headerConfig,
                        Duration timeout) {
        this.webClient = webClient;
        this.authentication = authentication;
        this.headerConfig = headerConfig;
        this.timeout = timeout;
    }

    /**
     * Executes an API call based on the provided {@link ApiRequest}.
     *
     * @param apiRequest The API request to execute. Must not be null.
     * @return The API response of a 2xx call.
     * @throws ApiException If the call fails, times out or returns a non-2xx status.
     */
    protected ApiResponse call(@NonNull ApiRequest apiRequest) {
        Objects.requireNonNull(apiRequest, "apiRequest must not be null");
        log.debug("Calling {} ({} {})", apiRequest.getOperation(), apiRequest.getMethod(), apiRequest.getPath());

        try {
            WebClient.RequestBodySpec requestBodySpec = configureRequest(apiRequest);
            configureHeaders(apiRequest, requestBodySpec);
            configureBody(apiRequest, requestBodySpec);

            long startNanos = System.nanoTime();
            ApiResponse apiResponse = requestBodySpec.exchangeToMono(response -> handleResponse(response, startNanos))
                                                     .timeout(timeout).onErrorMap(this::mapException).block();
            if (apiResponse != null) {
                log.debug("{} returned {} in {} ms", apiRequest.getOperation(), apiResponse.getStatusCode(),
                          apiResponse.getElapsedMillis());
            }
            return apiResponse;
        } catch (ApiException e) {
            log.warn("{} failed with status {}: {}", apiRequest.getOperation(), e.getStatusCode(), e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Exception during {}", apiRequest.getOperation(), e);
            throw mapException(e);
        }
    }

    /**
     * Maps exceptions to the {@link ApiException} family based on their type and, for
     * {@link WebClientResponseException}, the HTTP status code.
     */
    private ApiException mapException(Throwable error) {
        if (error instanceof ApiException apiException) {
            return apiException;
        }
        if (error instanceof WebClientResponseException webClientError) {
            return createException(webClientError.getResponseBodyAsString(), webClientError.getStatusCode().value());
        }
        if (error instanceof WebClientRequestException || error instanceof ConnectException
            || error instanceof UnknownHostException) {
            return new ServiceUnavailableException("Failed to connect to external service: " + error.getMessage());
        }
        if (error instanceof TimeoutException) {
            return new GatewayTimeoutException("Request timed out after " + timeout.toSeconds() + "s");
        }
        if (error instanceof WebClientException) {
            return new ApiException("Unexpected WebClient error: " + error.getMessage(),
                                    HttpStatus.INTERNAL_SERVER_ERROR.value());
        }
        return new ApiException("Internal API client error: " + error.getMessage(),
                                HttpStatus.INTERNAL_SERVER_ERROR.value());
    }

    private WebClient.RequestBodySpec configureRequest(ApiRequest apiRequest) {
        return webClient.method(apiRequest.getMethod()).uri(uriBuilder -> {
            uriBuilder.path(apiRequest.getPath());
            Optional.ofNullable(apiRequest.getQueryParams())
                    .ifPresent(params -> params.forEach((name, values) -> uriBuilder.queryParam(name, values.toArray())));
            return uriBuilder.build();
        });
    }

    /**
     * Applies authentication headers, the static {@link HeaderConfig} headers and the request's own headers.
     */
    private void configureHeaders(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        authentication.applyAuthentication(apiRequest.getHeaders());

        if (headerConfig != null && headerConfig.getHeaders() != null) {
            headerConfig.getHeaders().forEach(header -> requestBodySpec.header(header.getName(), header.getValue()));
        }

        apiRequest.getHeaders().forEach(requestBodySpec::header);
        Optional.ofNullable(apiRequest.getAcceptMediaType()).ifPresent(requestBodySpec::accept);
    }

    private void configureBody(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        if (apiRequest.getBody() == null) {
            return;
        }
        MediaType contentType = Optional.ofNullable(apiRequest.getContentType()).orElse(MediaType.APPLICATION_JSON);
        requestBodySpec.contentType(contentType);
        try {
            requestBodySpec.body(BodyInserters.fromValue(apiRequest.getBody()));
        } catch (Exception e) {
            log.error("Invalid request body {}", e.getMessage());
            throw new BadRequestException("Invalid request body: " + e.getMessage());
        }
    }

    private Mono<ApiResponse> handleResponse(ClientResponse response, long startNanos) {
        int statusCode = response.statusCode().value();
        if (!response.statusCode().is2xxSuccessful()) {
            log.warn("Response was NOT successful, statusCode {}", statusCode);
            return response.bodyToMono(String.class).defaultIfEmpty("")
                           .flatMap(body -> Mono.error(createException(body, statusCode)));
        }

        return response.bodyToMono(byte[].class).defaultIfEmpty(new byte[0])
                       .map(data -> ApiResponse.builder().data(data).statusCode(statusCode)
                                               .elapsedMillis(Duration.ofNanos(System.nanoTime() - startNanos).toMillis())
                                               .build())
                       .onErrorMap(error -> new ApiException("Error processing response: " + error.getMessage(),
                                                             statusCode));
    }

    /**
     * Creates the {@link ApiException} matching an HTTP status code.
     */
    private ApiException createException(String body, int statusCode) {
        ApiException exception = switch (statusCode) {
            case 400 -> new BadRequestException(body);
            case 401, 403 -> new UnauthorizedException(body);
            case 429 -> new TooManyRequestsException(body);
            case 502 -> new BadGatewayException(body);
            case 503 -> new ServiceUnavailableException(body);
            case 504 -> new GatewayTimeoutException(body);
            default -> new ApiException(body, statusCode);
        };
        log.debug("Mapped HTTP {} to {}", statusCode, exception.getClass().getSimpleName());
        return exception;
    }
}
