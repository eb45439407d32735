package com.mk.fx.qa.stress.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.net.Socket;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509ExtendedTrustManager;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

/**
 * Shared HTTP transport used by every stress worker. One underlying {@link HttpClient} is built at
 * construction and reused for the lifetime of the run; instances are safe for concurrent use and
 * are never mutated after construction.
 */
@Slf4j
public class StressHttpClient implements AutoCloseable {

    /** Default request timeout in seconds. */
    private static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 30;

    /** The underlying Java HTTP client. */
    private final HttpClient httpClient;

    /** Global headers to be included in all requests. */
    private final Map<String, String> headers;

    /** Base URL for all requests, without trailing slash. */
    private final String baseUrl;

    /** Timeout applied when a call does not provide its own. */
    private final Duration requestTimeout;

    /**
     * Constructs the transport.
     *
     * @param baseUri target server address
     * @param httpVersion protocol version requested on every call (defaults to HTTP/1.1)
     * @param connectTimeout connection timeout (defaults to 5 seconds)
     * @param requestTimeout default per-request timeout (defaults to 30 seconds)
     * @param trustAllCertificates accept any server certificate, for self-signed stress servers
     * @param headers global headers to include in all requests
     */
    @Builder
    public StressHttpClient(
            URI baseUri,
            HttpClient.Version httpVersion,
            Duration connectTimeout,
            Duration requestTimeout,
            boolean trustAllCertificates,
            Map<String, String> headers) {

        Objects.requireNonNull(baseUri, "Base URI cannot be null");
        this.baseUrl = validateAndNormalizeBaseUrl(baseUri.toString());
        this.requestTimeout =
                requestTimeout != null ? requestTimeout : Duration.ofSeconds(DEFAULT_REQUEST_TIMEOUT_SECONDS);
        var version = httpVersion != null ? httpVersion : HttpClient.Version.HTTP_1_1;
        var connect = connectTimeout != null ? connectTimeout : Duration.ofSeconds(5);

        var builder = HttpClient.newBuilder().version(version).connectTimeout(connect);
        if (trustAllCertificates) {
            builder.sslContext(trustAllContext());
        }
        this.httpClient = builder.build();
        this.headers = headers != null ? Map.copyOf(headers) : Map.of();

        log.info(
                "StressHttpClient initialised - Base URL: {}, Version: {}, Connection timeout: {}, Request timeout: {}, Trust all: {}",
                baseUrl,
                version,
                connect,
                this.requestTimeout,
                trustAllCertificates);
    }

    public String baseUrl() {
        return baseUrl;
    }

    /**
     * Issues a lightweight {@code GET /} against the target.
     *
     * @param timeout bound for the whole exchange
     * @return the HTTP status code; any status means the server is reachable
     * @throws RestClientException if the server could not be reached
     */
    public int probe(Duration timeout) {
        var request = new Request();
        request.setMethod(HttpMethod.GET);
        request.setPath("/");
        try {
            var response =
                    httpClient.send(buildHttpRequest(request, timeout), HttpResponse.BodyHandlers.discarding());
            return response.statusCode();
        } catch (IOException e) {
            throw new RestClientException("Could not reach " + baseUrl + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RestClientException("Interrupted while probing " + baseUrl, e);
        }
    }

    /**
     * Executes a synchronous REST request with the default timeout.
     *
     * @param request the REST request to execute
     * @return the response data
     * @throws RestClientException if the exchange fails at the transport level
     */
    public RestResponseData execute(Request request) {
        try {
            return sendAsync(request, requestTimeout).get();
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof RestClientException rce) {
                throw rce;
            }
            throw new RestClientException("Error executing request: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RestClientException("Interrupted while executing request", e);
        }
    }

    /**
     * Executes an asynchronous REST request. Cancelling the returned future aborts the exchange.
     *
     * @param request the REST request to execute
     * @param timeout per-request timeout; {@code null} uses the client default
     * @return a future completed with the response, or exceptionally with the transport error
     */
    public CompletableFuture<RestResponseData> sendAsync(Request request, Duration timeout) {
        Objects.requireNonNull(request, "Request cannot be null");

        var startTime = System.nanoTime();
        HttpRequest httpRequest;
        try {
            httpRequest = buildHttpRequest(request, timeout != null ? timeout : requestTimeout);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        log.debug("Executing async {} request to {}", request.getMethod(), httpRequest.uri());

        var exchange = httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString());
        CompletableFuture<RestResponseData> result =
                exchange.handle(
                        (response, throwable) -> {
                            if (throwable != null) {
                                var cause =
                                        throwable instanceof CompletionException && throwable.getCause() != null
                                                ? throwable.getCause()
                                                : throwable;
                                throw new RestClientException(
                                        request.getMethod() + " " + request.getPath() + " failed: " + cause.getMessage(),
                                        cause);
                            }
                            var duration = (System.nanoTime() - startTime) / 1_000_000;
                            log.debug("Request completed in {} ms with status {}", duration, response.statusCode());
                            return buildResponseData(response, duration);
                        });
        // dependent stages do not propagate cancellation upstream on their own
        result.whenComplete(
                (ignored, throwable) -> {
                    if (result.isCancelled()) {
                        exchange.cancel(true);
                    }
                });
        return result;
    }

    /**
     * Builds an HTTP request from the given Request.
     *
     * @param request the Request to build
     * @param timeout the timeout to apply to the exchange
     * @return the constructed HttpRequest
     */
    private HttpRequest buildHttpRequest(Request request, Duration timeout) {
        if (request.getMethod() == null) {
            throw new IllegalArgumentException("Request method is required");
        }
        var path = request.getPath() != null ? request.getPath() : "";
        var url = baseUrl + (path.startsWith("/") || path.isEmpty() ? path : "/" + path);

        if (request.getQuery() != null && !request.getQuery().isEmpty()) {
            url += "?" + buildQueryString(request.getQuery());
        }

        var requestBuilder = HttpRequest.newBuilder().uri(URI.create(url)).timeout(timeout);

        // global headers
        headers.forEach(requestBuilder::header);

        // request-specific headers override
        if (request.getHeaders() != null) {
            request.getHeaders().forEach(requestBuilder::setHeader);
        }

        if (request.getBody() != null) {
            try {
                var body = JsonUtil.toJson(request.getBody());
                requestBuilder.method(request.getMethod().name(), HttpRequest.BodyPublishers.ofString(body));
                if (!(request.getBody() instanceof String)) {
                    requestBuilder.setHeader("Content-Type", "application/json");
                }
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Failed to serialize request body: " + e.getMessage(), e);
            }
        } else {
            requestBuilder.method(request.getMethod().name(), HttpRequest.BodyPublishers.noBody());
        }

        return requestBuilder.build();
    }

    private RestResponseData buildResponseData(HttpResponse<String> response, long durationMs) {
        var result = new RestResponseData();
        result.setStatusCode(response.statusCode());
        result.setHeaders(
                response.headers().map().entrySet().stream()
                        .collect(Collectors.toMap(Map.Entry::getKey, e -> String.join(",", e.getValue()))));
        result.setBody(response.body());
        result.setResponseTimeMs(durationMs);
        return result;
    }

    private String buildQueryString(Map<String, String> query) {
        return query.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getValue() != null)
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
    }

    private String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private String validateAndNormalizeBaseUrl(String baseUrl) {
        var trimmed = baseUrl.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Base URL cannot be empty");
        }
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    private static SSLContext trustAllContext() {
        try {
            var context = SSLContext.getInstance("TLS");
            context.init(null, new TrustManager[] {new TrustAllManager()}, new SecureRandom());
            return context;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to initialise trust-all SSL context", e);
        }
    }

    @Override
    public void close() {
        // java.net.http.HttpClient only gained close() after JDK 17; connections are reclaimed on GC.
        log.debug("StressHttpClient for {} released", baseUrl);
    }

    /** Accepts every certificate chain; stress servers commonly run with self-signed certificates. */
    private static final class TrustAllManager extends X509ExtendedTrustManager {

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {}

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {}

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {}

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {}

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {}

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {}

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}
