package dev.catananti.cms.exception;

import java.util.Map;

/**
 * The caller is authenticated but not allowed to touch the resource.
 */
public class AuthorizationException extends CmsException {

    public AuthorizationException(String message) {
        super(message);
    }

    public AuthorizationException(String message, Map<String, Object> details) {
        super(message, details);
    }

    public AuthorizationException(String message, Map<String, Object> details, Throwable cause) {
        super(message, details, cause);
    }
}
