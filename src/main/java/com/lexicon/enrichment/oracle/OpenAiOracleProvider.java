package com.lexicon.enrichment.oracle;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Oracle backed by an OpenAI-compatible chat completions endpoint with {@code response_format: json_object}.
 */
public class OpenAiOracleProvider extends HttpOracleProvider {

    static final String SYSTEM_MESSAGE =
            "You are a helpful expert linguist. Your output must be a single, valid JSON object and nothing else.";

    private static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
    private static final String DEFAULT_MODEL = "gpt-4-turbo";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    private final String apiKey;

    private OpenAiOracleProvider(Builder builder) {
        super(builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL,
                builder.model != null ? builder.model : DEFAULT_MODEL,
                builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT);
        this.apiKey = Objects.requireNonNull(builder.apiKey, "apiKey is required");
        if (apiKey.isBlank()) {
            throw new IllegalArgumentException("apiKey must not be blank");
        }
    }

    @Override
    protected HttpRequest.Builder buildRequest(String prompt) throws IOException {
        ChatRequest chatRequest = new ChatRequest(model,
                List.of(new ChatMessage("system", SYSTEM_MESSAGE), new ChatMessage("user", prompt)),
                new ResponseFormat("json_object"));
        return HttpRequest.newBuilder()
                .uri(endpoint("/chat/completions"))
                .header("Content-Type", "application/json; charset=utf-8")
                .header("Authorization", "Bearer " + apiKey)
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(chatRequest)));
    }

    @Override
    protected String extractContent(String body) throws IOException {
        ChatResponse response = objectMapper.readValue(body, ChatResponse.class);
        if (response.choices() == null || response.choices().isEmpty() || response.choices().get(0).message() == null) {
            return null;
        }
        return response.choices().get(0).message().content();
    }

    @Override
    protected HttpRequest.Builder availabilityRequest() {
        return HttpRequest.newBuilder()
                .uri(endpoint("/models"))
                .header("Authorization", "Bearer " + apiKey);
    }

    @Override
    public String getProviderName() {
        return "OpenAI/" + model;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private String model;
        private String apiKey;
        private Duration timeout;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public OpenAiOracleProvider build() {
            return new OpenAiOracleProvider(this);
        }
    }

    record ChatRequest(
            String model,
            List<ChatMessage> messages,
            @JsonProperty("response_format") ResponseFormat responseFormat
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatMessage(String role, String content) {}

    record ResponseFormat(String type) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatResponse(List<Choice> choices) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Choice(int index, ChatMessage message) {}
}
