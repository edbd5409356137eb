package dev.catananti.cms.exception;

import lombok.Getter;

import java.util.Map;

/**
 * Root of the domain exceptions. Each subclass maps to exactly one row of {@link ErrorClassification}.
 */
@Getter
public abstract class CmsException extends RuntimeException {

    private final Map<String, Object> details;

    protected CmsException(String message) {
        this(message, Map.of(), null);
    }

    protected CmsException(String message, Map<String, Object> details) {
        this(message, details, null);
    }

    protected CmsException(String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }
}
