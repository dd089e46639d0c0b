package com.abhikarta.orchestrator.planning;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * {@link PlanningStrategy} backed by the Anthropic Messages API.
 *
 * Single-turn only: each planning decision is one user message and one reply.
 * With no API key configured every call fails fast with
 * {@link PlanningUnavailableException}, which the supervisor turns into its
 * fallback decisions.
 */
@Component
public class ClaudePlanningStrategy implements PlanningStrategy {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        String firstText() {
            if (content == null) {
                throw new PlanningUnavailableException("Empty response from planner");
            }
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElseThrow(() -> new PlanningUnavailableException("No text block in planner response"));
        }
    }

    private static final String API_URL    = "https://api.anthropic.com/v1/messages";
    private static final String API_VER    = "2023-06-01";
    private static final int    MAX_TOKENS = 4096;

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiKey;
    private final String       model;

    public ClaudePlanningStrategy(@Value("${anthropic.api-key:}") String apiKey,
                                  @Value("${abhikarta.planner.model:claude-sonnet-4-6}") String model,
                                  ObjectMapper objectMapper) {
        this.apiKey = apiKey;
        this.model  = model;
        this.json   = objectMapper;
        this.http   = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public String generate(String prompt) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new PlanningUnavailableException("No Anthropic API key configured");
        }
        try {
            String requestBody = json.writeValueAsString(Map.of(
                    "model",      model,
                    "max_tokens", MAX_TOKENS,
                    "messages",   List.of(Map.of("role", "user", "content", prompt))
            ));

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(API_URL))
                    .timeout(Duration.ofSeconds(60))
                    .header("content-type",      "application/json")
                    .header("x-api-key",         apiKey)
                    .header("anthropic-version", API_VER)
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new PlanningUnavailableException(
                        "Planner API error %d: %s".formatted(response.statusCode(), response.body()),
                        response.statusCode(), null);
            }
            return json.readValue(response.body(), MessagesResponse.class).firstText();

        } catch (IOException e) {
            throw new PlanningUnavailableException("Planner API call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PlanningUnavailableException("Interrupted while waiting for the planner", e);
        }
    }
}
