package dev.catananti.cms.exception;

import org.springframework.http.HttpStatus;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.server.ServerWebInputException;

import java.util.List;

/**
 * Static mapping from error kind to HTTP status and severity.
 * Rows are matched in declaration order; {@link #UNCLASSIFIED} catches everything else.
 */
public enum ErrorClassification {
    VALIDATION(HttpStatus.BAD_REQUEST, ErrorSeverity.MEDIUM,
            List.of(ValidationException.class, ServerWebInputException.class)),
    AUTHENTICATION(HttpStatus.UNAUTHORIZED, ErrorSeverity.MEDIUM,
            List.of(AuthenticationFailedException.class)),
    AUTHORIZATION(HttpStatus.FORBIDDEN, ErrorSeverity.MEDIUM,
            List.of(AuthorizationException.class, AccessDeniedException.class)),
    NOT_FOUND(HttpStatus.NOT_FOUND, ErrorSeverity.LOW,
            List.of(ResourceNotFoundException.class)),
    BUSINESS_RULE(HttpStatus.UNPROCESSABLE_ENTITY, ErrorSeverity.MEDIUM,
            List.of(BusinessRuleException.class)),
    SECURITY(HttpStatus.BAD_REQUEST, ErrorSeverity.HIGH,
            List.of(SecurityViolationException.class)),
    DATABASE(HttpStatus.INTERNAL_SERVER_ERROR, ErrorSeverity.HIGH,
            List.of(DatabaseException.class)),
    UNCLASSIFIED(HttpStatus.INTERNAL_SERVER_ERROR, ErrorSeverity.HIGH, List.of());

    private final HttpStatus status;
    private final ErrorSeverity severity;
    private final List<Class<? extends Throwable>> kinds;

    ErrorClassification(HttpStatus status, ErrorSeverity severity, List<Class<? extends Throwable>> kinds) {
        this.status = status;
        this.severity = severity;
        this.kinds = kinds;
    }

    public HttpStatus status() {
        return status;
    }

    public ErrorSeverity severity() {
        return severity;
    }

    /**
     * Whether the outward message may be taken from the exception itself.
     * Unclassified and storage errors fall back to the severity default so internals stay in the log.
     */
    public boolean exposesMessage() {
        return this != UNCLASSIFIED && this != DATABASE;
    }

    public static ErrorClassification classify(Throwable error) {
        for (ErrorClassification classification : values()) {
            for (Class<? extends Throwable> kind : classification.kinds) {
                if (kind.isInstance(error)) {
                    return classification;
                }
            }
        }
        return UNCLASSIFIED;
    }
}
