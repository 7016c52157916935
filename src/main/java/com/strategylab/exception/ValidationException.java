package com.strategylab.exception;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Raised when a batch request cannot be executed as given: unbound variable tokens,
 * empty variable lists, malformed assignments or values that do not fit the field
 * they are substituted into.
 *
 * <p>Clients raise it before contacting the server; the server raises it again for
 * requests that skipped client-side checks.
 */
public class ValidationException extends BaseException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }

    public static ValidationException missingVariables(Collection<String> missing) {
        List<String> names = missing.stream().sorted().toList();
        return new ValidationException(
                "Undefined variables: " + String.join(", ", names), Map.of("missingVariables", names));
    }

    public static ValidationException emptyVariable(String name) {
        return new ValidationException(
                "Variable " + name + " has no values", Map.of("emptyVariables", List.of(name)));
    }
}
