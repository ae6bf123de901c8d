package com.example.dbmonitor.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * One ranked optimization recommendation for a target.
 */
public record Suggestion(String title, String description, Priority priority, String category) {

    public enum Priority {
        HIGH, MEDIUM, LOW;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        /**
         * Lenient lookup used when reading model output.
         *
         * @throws IllegalArgumentException for anything other than high, medium or low
         */
        @JsonCreator
        public static Priority fromValue(String value) {
            if (value == null) {
                throw new IllegalArgumentException("priority is required");
            }
            return Priority.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }
}
