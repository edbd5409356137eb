package dev.catananti.cms.exception;

import java.util.List;
import java.util.Map;

/**
 * Schema-level rejection of an inbound payload. Carries the individual violations as {@code validation_errors}.
 */
public class SecurityViolationException extends CmsException {

    public SecurityViolationException(String message, List<String> validationErrors) {
        super(message, Map.of("validation_errors", List.copyOf(validationErrors)));
    }

    @SuppressWarnings("unchecked")
    public List<String> getValidationErrors() {
        return (List<String>) getDetails().getOrDefault("validation_errors", List.of());
    }
}
