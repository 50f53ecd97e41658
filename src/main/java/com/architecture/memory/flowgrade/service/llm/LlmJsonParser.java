package com.architecture.memory.flowgrade.service.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes JSON objects out of chat model replies. Models tend to wrap the object in
 * Markdown fences or surround it with prose, so both are stripped before decoding.
 */
@Component
public class LlmJsonParser {

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json|JSON)?\\s*(.*?)\\s*```", Pattern.DOTALL);

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public ParseResult<JsonNode> parseTree(String text) {
        String json = extractJson(text);
        if (json == null) {
            return ParseResult.failure("Response contains no JSON object");
        }
        try {
            JsonNode tree = objectMapper.readTree(json);
            if (tree == null || !tree.isObject()) {
                return ParseResult.failure("Response is not a JSON object");
            }
            return ParseResult.ok(tree);
        } catch (JsonProcessingException e) {
            return ParseResult.failure("Invalid JSON: " + e.getOriginalMessage());
        }
    }

    public <T> ParseResult<T> parse(String text, Class<T> type) {
        ParseResult<JsonNode> tree = parseTree(text);
        if (!tree.isOk()) {
            return ParseResult.failure(tree.getFailureReason());
        }
        try {
            return ParseResult.ok(objectMapper.treeToValue(tree.getValue(), type));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return ParseResult.failure("JSON does not match " + type.getSimpleName() + ": " + e.getMessage());
        }
    }

    private String extractJson(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }

        String candidate = text.trim();
        Matcher fence = CODE_FENCE.matcher(candidate);
        if (fence.find()) {
            candidate = fence.group(1).trim();
        }

        int start = candidate.indexOf('{');
        int end = candidate.lastIndexOf('}');
        if (start == -1 || end <= start) {
            return null;
        }
        return candidate.substring(start, end + 1);
    }
}
