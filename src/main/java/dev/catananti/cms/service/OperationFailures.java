package dev.catananti.cms.service;

import dev.catananti.cms.exception.AuthenticationFailedException;
import dev.catananti.cms.exception.CmsException;
import dev.catananti.cms.exception.ErrorManager;
import dev.catananti.cms.exception.ErrorRecord;
import dev.catananti.cms.exception.ErrorSeverity;
import dev.catananti.cms.exception.ValidationException;

import java.util.HashMap;
import java.util.Map;

/**
 * Reports a failed service operation at MEDIUM severity and re-raises it with the outward message.
 * The original reason and the reported error id travel in the details of the new exception.
 */
final class OperationFailures {

    private OperationFailures() {
    }

    static CmsException report(ErrorManager errorManager, Throwable cause,
                               Map<String, Object> context, String userMessage) {
        ErrorRecord record = errorManager.handle(cause, ErrorSeverity.MEDIUM, context, userMessage);
        Map<String, Object> details = new HashMap<>(context);
        details.put("reason", String.valueOf(cause.getMessage()));
        details.put("service_error_id", record.errorId());
        if (cause instanceof AuthenticationFailedException) {
            return new AuthenticationFailedException(record.message(), details, cause);
        }
        return new ValidationException(record.message(), details, cause);
    }

    /** Validation messages are safe to show; anything else gets the severity default. */
    static String outwardMessage(Throwable cause) {
        return cause instanceof ValidationException ? cause.getMessage() : null;
    }
}
