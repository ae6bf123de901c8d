package com.example.dbmonitor.suggestion;

import com.example.dbmonitor.domain.Suggestion;
import com.example.dbmonitor.domain.SuggestionSet;

import java.util.List;

/**
 * Outcome of one synthesis run: either three suggestions parsed from the model
 * answer, or three derived from the metrics when the answer was unusable.
 */
public sealed interface SynthesisResult permits SynthesisResult.Parsed, SynthesisResult.Fallback {

    List<Suggestion> suggestions();

    SuggestionSet.Source source();

    record Parsed(List<Suggestion> suggestions) implements SynthesisResult {
        public Parsed {
            suggestions = List.copyOf(suggestions);
        }

        @Override
        public SuggestionSet.Source source() {
            return SuggestionSet.Source.AI;
        }
    }

    record Fallback(List<Suggestion> suggestions, String reason) implements SynthesisResult {
        public Fallback {
            suggestions = List.copyOf(suggestions);
        }

        @Override
        public SuggestionSet.Source source() {
            return SuggestionSet.Source.FALLBACK;
        }
    }
}
