package com.strategylab.domain.enums;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Kind of values a variable list holds. Each kind normalizes raw user input and
 * rejects values that cannot be bound to the fields the kind is meant for.
 */
public enum VariableType {
    @JsonProperty("ticker")
    TICKER {
        @Override
        public Optional<String> normalizeValue(String raw) {
            String upper = raw.trim().toUpperCase(Locale.ROOT);
            return TICKER_PATTERN.matcher(upper).matches() ? Optional.of(upper) : Optional.empty();
        }
    },

    @JsonProperty("number")
    NUMBER {
        @Override
        public Optional<String> normalizeValue(String raw) {
            String trimmed = raw.trim();
            try {
                new BigDecimal(trimmed);
                return Optional.of(trimmed);
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
    },

    @JsonProperty("date")
    DATE {
        @Override
        public Optional<String> normalizeValue(String raw) {
            String trimmed = raw.trim();
            if ("max".equalsIgnoreCase(trimmed)) {
                return Optional.of("max");
            }
            return DATE_PATTERN.matcher(trimmed).matches() ? Optional.of(trimmed) : Optional.empty();
        }
    };

    private static final Pattern TICKER_PATTERN = Pattern.compile("^[A-Z0-9._-]{1,12}$");
    private static final Pattern DATE_PATTERN = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

    /** Returns the canonical form of {@code raw}, or empty if it is not a valid value of this kind. */
    public abstract Optional<String> normalizeValue(String raw);
}
