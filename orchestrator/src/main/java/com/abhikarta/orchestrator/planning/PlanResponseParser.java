package com.abhikarta.orchestrator.planning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * Turns planner text into typed decisions.
 *
 * The planner is asked for bare JSON but often wraps it in a markdown fence
 * or a sentence of prose. Extraction order:
 *   1. a ```json fenced block
 *   2. any ``` fenced block
 *   3. the outermost { ... } span
 *
 * Anything that still fails to bind, including unknown enum values, raises
 * {@link PlanParseException}.
 */
@Component
public class PlanResponseParser {

    private final ObjectMapper objectMapper;

    public PlanResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public RequestAnalysis parseAnalysis(String content) {
        return parse(content, RequestAnalysis.class);
    }

    public StrategyDecision parseDecision(String content) {
        return parse(content, StrategyDecision.class);
    }

    public ExecutionPlan parsePlan(String content) {
        return parse(content, ExecutionPlan.class);
    }

    private <T> T parse(String content, Class<T> type) {
        if (content == null || content.isBlank()) {
            throw new PlanParseException("Empty planner response");
        }
        String json = extractJson(content);
        try {
            T value = objectMapper.readValue(json, type);
            if (value == null) {
                throw new PlanParseException("Planner returned null for " + type.getSimpleName());
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new PlanParseException(
                    "Failed to parse " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    static String extractJson(String content) {
        int start = content.indexOf("```json");
        if (start >= 0) {
            start = content.indexOf('\n', start) + 1;
            int end = content.indexOf("```", start);
            if (start > 0 && end > start) {
                return content.substring(start, end).trim();
            }
        }

        start = content.indexOf("```");
        if (start >= 0) {
            start = content.indexOf('\n', start) + 1;
            int end = content.indexOf("```", start);
            if (start > 0 && end > start) {
                return content.substring(start, end).trim();
            }
        }

        int objectStart = content.indexOf('{');
        int objectEnd   = content.lastIndexOf('}');
        if (objectStart >= 0 && objectEnd > objectStart) {
            return content.substring(objectStart, objectEnd + 1);
        }
        return content.trim();
    }
}
