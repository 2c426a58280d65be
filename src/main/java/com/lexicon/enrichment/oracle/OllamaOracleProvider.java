package com.lexicon.enrichment.oracle;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.time.Duration;

/**
 * Oracle backed by a local Ollama server, using {@code /api/generate} in JSON mode.
 *
 * <pre>
 * OllamaOracleProvider provider = OllamaOracleProvider.builder()
 *     .baseUrl("http://localhost:11434")
 *     .model("llama3.2")
 *     .build();
 * </pre>
 */
public class OllamaOracleProvider extends HttpOracleProvider {

    private static final String DEFAULT_BASE_URL = "http://localhost:11434";
    private static final String DEFAULT_MODEL = "llama3.2";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    private OllamaOracleProvider(Builder builder) {
        super(builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL,
                builder.model != null ? builder.model : DEFAULT_MODEL,
                builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT);
    }

    @Override
    protected HttpRequest.Builder buildRequest(String prompt) throws IOException {
        String requestBody = objectMapper.writeValueAsString(new GenerateRequest(model, prompt, false, "json"));
        return HttpRequest.newBuilder()
                .uri(endpoint("/api/generate"))
                .header("Content-Type", "application/json; charset=utf-8")
                .POST(HttpRequest.BodyPublishers.ofString(requestBody));
    }

    @Override
    protected String extractContent(String body) throws IOException {
        return objectMapper.readValue(body, GenerateResponse.class).response();
    }

    @Override
    protected HttpRequest.Builder availabilityRequest() {
        return HttpRequest.newBuilder().uri(endpoint("/api/tags"));
    }

    @Override
    public String getProviderName() {
        return "Ollama/" + model;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static OllamaOracleProvider createDefault() {
        return builder().build();
    }

    public static class Builder {
        private String baseUrl;
        private String model;
        private Duration timeout;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public OllamaOracleProvider build() {
            return new OllamaOracleProvider(this);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GenerateRequest(
            String model,
            String prompt,
            boolean stream,
            String format
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GenerateResponse(
            String model,
            @JsonProperty("created_at") String createdAt,
            String response,
            boolean done
    ) {}
}
