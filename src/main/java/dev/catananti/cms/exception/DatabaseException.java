package dev.catananti.cms.exception;

import java.util.Map;

/**
 * Storage failure that was not absorbed locally, such as an exhausted slug retry.
 */
public class DatabaseException extends CmsException {

    public DatabaseException(String message) {
        super(message);
    }

    public DatabaseException(String message, Map<String, Object> details) {
        super(message, details);
    }

    public DatabaseException(String message, Map<String, Object> details, Throwable cause) {
        super(message, details, cause);
    }
}
