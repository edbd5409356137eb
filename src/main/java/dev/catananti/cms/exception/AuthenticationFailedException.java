package dev.catananti.cms.exception;

import java.util.Map;

/**
 * Bad credentials or a deactivated account.
 */
public class AuthenticationFailedException extends CmsException {

    public AuthenticationFailedException(String message) {
        super(message);
    }

    public AuthenticationFailedException(String message, Map<String, Object> details) {
        super(message, details);
    }

    public AuthenticationFailedException(String message, Map<String, Object> details, Throwable cause) {
        super(message, details, cause);
    }
}
