package com.strategylab.variable;

import java.util.Locale;
import java.util.regex.Pattern;

/** Recognition and normalization of {@code $name} variable tokens. */
public final class VariableTokens {

    public static final Pattern TOKEN_PATTERN = Pattern.compile("^\\$[A-Za-z0-9_]+$");

    private VariableTokens() {}

    /** True if the whole (trimmed) value is a single variable token. */
    public static boolean isToken(String value) {
        return value != null && TOKEN_PATTERN.matcher(value.trim()).matches();
    }

    /**
     * Canonical variable name: trimmed, leading {@code $} removed, lower case.
     * {@code " $RiskOn "} becomes {@code "riskon"}.
     */
    public static String normalizeName(String name) {
        if (name == null) {
            return "";
        }
        String trimmed = name.trim();
        String withoutDollar = trimmed.startsWith("$") ? trimmed.substring(1) : trimmed;
        return withoutDollar.toLowerCase(Locale.ROOT);
    }
}
