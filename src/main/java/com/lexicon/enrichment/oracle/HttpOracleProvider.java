package com.lexicon.enrichment.oracle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Shared HTTP plumbing of the JSON-mode oracle providers.
 */
public abstract class HttpOracleProvider implements OracleProvider {
    private static final Logger log = LoggerFactory.getLogger(HttpOracleProvider.class);

    static final int TOO_MANY_REQUESTS = 429;

    protected final String baseUrl;
    protected final String model;
    protected final Duration timeout;
    protected final HttpClient httpClient;
    protected final ObjectMapper objectMapper;

    protected HttpOracleProvider(String baseUrl, String model, Duration timeout) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.model = model;
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Request carrying the prompt, without the client timeout.
     */
    protected abstract HttpRequest.Builder buildRequest(String prompt) throws IOException;

    /**
     * Extracts the model's text answer from a 2xx response body.
     */
    protected abstract String extractContent(String body) throws IOException;

    @Override
    public JsonNode complete(String prompt) {
        HttpResponse<String> response;
        try {
            HttpRequest request = buildRequest(prompt)
                    .timeout(timeout)
                    .build();
            log.debug("oracle.request provider={} prompt_length={}", getProviderName(), prompt.length());
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new OracleException(getProviderName() + " did not answer within " + timeout, e);
        } catch (IOException e) {
            throw new OracleException("Error calling " + getProviderName() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OracleException("Interrupted while calling " + getProviderName(), e);
        }
        return handleResponse(response.statusCode(), response.body());
    }

    /**
     * Maps the HTTP status and body to a parsed answer or to the matching exception.
     */
    JsonNode handleResponse(int status, String body) {
        if (status == TOO_MANY_REQUESTS) {
            throw new RateLimitedException(getProviderName() + " rate limit hit (HTTP 429)");
        }
        if (status < 200 || status >= 300) {
            throw new OracleException(getProviderName() + " returned status " + status + ": "
                    + JsonPayloads.excerpt(body == null ? "" : body));
        }
        String content;
        try {
            content = extractContent(body);
        } catch (IOException e) {
            throw new InvalidOracleResponseException(getProviderName() + " returned an unreadable envelope", e);
        }
        if (content == null) {
            throw new InvalidOracleResponseException(getProviderName() + " returned no content");
        }
        return JsonPayloads.parse(objectMapper, content);
    }

    protected URI endpoint(String path) {
        return URI.create(baseUrl + path);
    }

    @Override
    public boolean isAvailable() {
        try {
            HttpRequest request = availabilityRequest()
                    .timeout(Duration.ofSeconds(5))
                    .GET()
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return response.statusCode() == 200;
        } catch (IOException e) {
            log.debug("oracle.unavailable provider={} error={}", getProviderName(), e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    protected abstract HttpRequest.Builder availabilityRequest();

    public String getModel() {
        return model;
    }
}
