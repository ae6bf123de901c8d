package com.example.dbmonitor.suggestion;

import com.example.dbmonitor.config.AppConfig;
import com.example.dbmonitor.domain.Suggestion;
import com.example.dbmonitor.exception.SynthesisParseException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SuggestionResponseParserTest {

    private static final String THREE = """
            [
              {"title": "Add Index on orders.customer_id", "description": "Sequential scans on orders [hot path].", "priority": "high", "category": "indexing"},
              {"title": "Partition events", "description": "events has 40M rows.", "priority": "Medium", "category": "partitioning"},
              {"title": "Drop unused tables", "description": "tmp_import is never read.", "priority": "low", "category": "maintenance"}
            ]
            """;

    private final SuggestionResponseParser parser = new SuggestionResponseParser(new AppConfig().objectMapper());

    @Test
    void parsesBareArray() {
        List<Suggestion> suggestions = parser.parse(THREE);

        assertEquals(3, suggestions.size());
        assertEquals("Add Index on orders.customer_id", suggestions.get(0).title());
        assertEquals(Suggestion.Priority.HIGH, suggestions.get(0).priority());
        assertEquals(Suggestion.Priority.MEDIUM, suggestions.get(1).priority());
        assertEquals("maintenance", suggestions.get(2).category());
    }

    @Test
    void findsArrayInsideProseAndCodeFences() {
        String response = "Here are my recommendations [based on the metrics]:\n```json\n" + THREE + "```\nHope this helps.";

        List<Suggestion> suggestions = parser.parse(response);

        assertEquals(3, suggestions.size());
        assertEquals("Partition events", suggestions.get(1).title());
    }

    @Test
    void rejectsWrongCount() {
        String two = """
                [{"title": "a", "description": "b", "priority": "high", "category": "indexing"},
                 {"title": "c", "description": "d", "priority": "low", "category": "monitoring"}]
                """;

        assertThrows(SynthesisParseException.class, () -> parser.parse(two));
    }

    @Test
    void rejectsUnknownPriority() {
        String response = THREE.replace("\"high\"", "\"urgent\"");

        assertThrows(SynthesisParseException.class, () -> parser.parse(response));
    }

    @Test
    void rejectsMissingFields() {
        String response = THREE.replace("\"title\": \"Partition events\", ", "");

        assertThrows(SynthesisParseException.class, () -> parser.parse(response));
    }

    @Test
    void rejectsNonJson() {
        assertThrows(SynthesisParseException.class, () -> parser.parse("I cannot help with that."));
        assertThrows(SynthesisParseException.class, () -> parser.parse("[unterminated"));
        assertThrows(SynthesisParseException.class, () -> parser.parse(""));
        assertThrows(SynthesisParseException.class, () -> parser.parse(null));
    }

    @Test
    void bracketMatchingIgnoresBracketsInStrings() {
        String text = "x [\"a]\", [1, 2]] y";

        assertEquals(text.lastIndexOf(']'), SuggestionResponseParser.matchingBracket(text, text.indexOf('[')));
        assertEquals(-1, SuggestionResponseParser.matchingBracket("[[1]", 0));
    }
}
