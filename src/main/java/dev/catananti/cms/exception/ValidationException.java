package dev.catananti.cms.exception;

import java.util.Map;

/**
 * Bad input shape or content.
 */
public class ValidationException extends CmsException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Map<String, Object> details) {
        super(message, details);
    }

    public ValidationException(String message, Map<String, Object> details, Throwable cause) {
        super(message, details, cause);
    }
}
