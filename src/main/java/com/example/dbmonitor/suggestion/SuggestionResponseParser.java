package com.example.dbmonitor.suggestion;

import com.example.dbmonitor.domain.Suggestion;
import com.example.dbmonitor.exception.SynthesisParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts exactly three suggestions from a free-form model answer.
 *
 * The answer may wrap the JSON array in prose or code fences. The first
 * bracketed span that parses as JSON is taken as the answer and must hold
 * three objects with a title, description, category and a priority of high,
 * medium or low.
 */
@Component
@RequiredArgsConstructor
public class SuggestionResponseParser {

    static final int EXPECTED_SUGGESTIONS = 3;

    private final ObjectMapper objectMapper;

    public List<Suggestion> parse(String response) {
        if (response == null || response.isBlank()) {
            throw new SynthesisParseException("Empty model response");
        }

        for (int start = response.indexOf('['); start >= 0; start = response.indexOf('[', start + 1)) {
            int end = matchingBracket(response, start);
            if (end < 0) {
                continue;
            }
            JsonNode node;
            try {
                node = objectMapper.readTree(response.substring(start, end + 1));
            } catch (JsonProcessingException e) {
                continue;
            }
            return toSuggestions(node);
        }
        throw new SynthesisParseException("No JSON array found in model response");
    }

    private List<Suggestion> toSuggestions(JsonNode array) {
        if (array.size() != EXPECTED_SUGGESTIONS) {
            throw new SynthesisParseException(
                    "Expected " + EXPECTED_SUGGESTIONS + " suggestions, got " + array.size());
        }
        List<Suggestion> suggestions = new ArrayList<>(EXPECTED_SUGGESTIONS);
        for (JsonNode item : array) {
            if (!item.isObject()) {
                throw new SynthesisParseException("Suggestion is not an object: " + item);
            }
            Suggestion.Priority priority;
            try {
                priority = Suggestion.Priority.fromValue(item.path("priority").asText(null));
            } catch (IllegalArgumentException e) {
                throw new SynthesisParseException("Invalid priority: " + item.path("priority"), e);
            }
            suggestions.add(new Suggestion(
                    requiredText(item, "title"),
                    requiredText(item, "description"),
                    priority,
                    requiredText(item, "category")));
        }
        return suggestions;
    }

    private static String requiredText(JsonNode item, String field) {
        JsonNode value = item.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new SynthesisParseException("Suggestion is missing " + field);
        }
        return value.asText().trim();
    }

    /**
     * Index of the bracket closing the one at {@code start}, skipping brackets
     * inside JSON strings; -1 when the text ends first.
     */
    static int matchingBracket(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            switch (c) {
                case '"' -> inString = true;
                case '[' -> depth++;
                case ']' -> {
                    depth--;
                    if (depth == 0) {
                        return i;
                    }
                }
                default -> { }
            }
        }
        return -1;
    }
}
