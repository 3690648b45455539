package com.entity.linking.store.http;

import com.entity.linking.logging.Redaction;
import com.entity.linking.store.BackendUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Thin JSON-over-HTTP client shared by the backend adapters.
 *
 * <p>Every call carries the per-request timeout. Transport errors, timeouts, non-success statuses
 * and undecodable bodies all surface as {@link BackendUnavailableException}; the only status that
 * is not an error is 404 on lookups, which callers receive as an empty result.</p>
 *
 * <pre>
 * BackendClient client = BackendClient.builder()
 *     .name("item-store")
 *     .baseUrl("http://localhost:3000")
 *     .timeout(Duration.ofSeconds(5))
 *     .build();
 * </pre>
 */
public class BackendClient {
    private static final Logger log = LoggerFactory.getLogger(BackendClient.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final String name;
    private final String baseUrl;
    private final Duration timeout;
    private final String bearerToken;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private BackendClient(Builder builder) {
        this.name = builder.name;
        this.baseUrl = stripTrailingSlash(builder.baseUrl);
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.bearerToken = builder.bearerToken;
        this.httpClient = builder.httpClient != null
                ? builder.httpClient
                : HttpClient.newBuilder().connectTimeout(timeout).build();
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public String getName() {
        return name;
    }

    /**
     * GETs a JSON document.
     *
     * @return the decoded body, or empty if the backend answered 404
     */
    public <T> Optional<T> get(String path, Map<String, String> query, Class<T> type) {
        HttpRequest request = newRequest(path, query).GET().build();
        HttpResponse<String> response = send(request);
        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        requireSuccess(response);
        return Optional.of(decode(response.body(), type));
    }

    /**
     * POSTs a JSON document and decodes the JSON answer.
     */
    public <T> T post(String path, Object body, Class<T> type) {
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new BackendUnavailableException(name, BackendUnavailableException.NO_STATUS,
                    "could not encode request", e);
        }
        HttpRequest request = newRequest(path, Map.of())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();
        HttpResponse<String> response = send(request);
        requireSuccess(response);
        return decode(response.body(), type);
    }

    /**
     * DELETEs a resource.
     *
     * @return true if the backend confirmed the delete, false if it answered 404
     */
    public boolean delete(String path) {
        HttpRequest request = newRequest(path, Map.of()).DELETE().build();
        HttpResponse<String> response = send(request);
        if (response.statusCode() == 404) {
            return false;
        }
        requireSuccess(response);
        return true;
    }

    private HttpRequest.Builder newRequest(String path, Map<String, String> query) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path + queryString(query)))
                .timeout(timeout)
                .header("Accept", "application/json");
        if (bearerToken != null && !bearerToken.isBlank()) {
            builder.header("Authorization", "Bearer " + bearerToken);
        }
        return builder;
    }

    private HttpResponse<String> send(HttpRequest request) {
        log.debug("backend.request backend={} method={} path={}", name, request.method(), request.uri().getPath());
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new BackendUnavailableException(name, BackendUnavailableException.NO_STATUS,
                    request.method() + " " + request.uri().getPath() + " failed: " + Redaction.sanitizeError(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendUnavailableException(name, BackendUnavailableException.NO_STATUS,
                    request.method() + " " + request.uri().getPath() + " interrupted", e);
        }
    }

    private void requireSuccess(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new BackendUnavailableException(name, status,
                    response.request().method() + " " + response.request().uri().getPath()
                            + " returned status " + status + ": " + Redaction.sanitizeMessage(response.body()));
        }
    }

    private <T> T decode(String body, Class<T> type) {
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new BackendUnavailableException(name, BackendUnavailableException.NO_STATUS,
                    "could not decode " + type.getSimpleName() + " response", e);
        }
    }

    static String queryString(Map<String, String> query) {
        if (query == null || query.isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner("&", "?", "");
        for (Map.Entry<String, String> entry : query.entrySet()) {
            if (entry.getValue() != null) {
                joiner.add(encode(entry.getKey()) + "=" + encode(entry.getValue()));
            }
        }
        return joiner.toString();
    }

    static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    /**
     * Ordered query-parameter map; null values are skipped when the query string is built.
     */
    static Map<String, String> params(String... keyValues) {
        Map<String, String> params = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            params.put(keyValues[i], keyValues[i + 1]);
        }
        return params;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name = "backend";
        private String baseUrl;
        private Duration timeout;
        private String bearerToken;
        private HttpClient httpClient;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder bearerToken(String bearerToken) {
            this.bearerToken = bearerToken;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public BackendClient build() {
            if (baseUrl == null || baseUrl.isBlank()) {
                throw new IllegalStateException("baseUrl is required");
            }
            if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
                throw new IllegalStateException("timeout must be positive");
            }
            return new BackendClient(this);
        }
    }
}
