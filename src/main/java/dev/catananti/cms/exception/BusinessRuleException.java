package dev.catananti.cms.exception;

import java.util.Map;

/**
 * Valid input that a business rule rejects, e.g. editing an article that does not exist.
 */
public class BusinessRuleException extends CmsException {

    public BusinessRuleException(String message) {
        super(message);
    }

    public BusinessRuleException(String message, Map<String, Object> details) {
        super(message, details);
    }

    public BusinessRuleException(String message, Map<String, Object> details, Throwable cause) {
        super(message, details, cause);
    }
}
