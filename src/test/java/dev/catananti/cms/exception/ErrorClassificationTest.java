package dev.catananti.cms.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.server.ServerWebInputException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorClassificationTest {

    @Test
    @DisplayName("should map each domain error to its status and severity")
    void shouldClassifyDomainErrors() {
        assertClassified(new ValidationException("bad"), HttpStatus.BAD_REQUEST, ErrorSeverity.MEDIUM);
        assertClassified(new AuthenticationFailedException("who"), HttpStatus.UNAUTHORIZED, ErrorSeverity.MEDIUM);
        assertClassified(new AuthorizationException("no"), HttpStatus.FORBIDDEN, ErrorSeverity.MEDIUM);
        assertClassified(new ResourceNotFoundException("Article", "slug", "x"), HttpStatus.NOT_FOUND, ErrorSeverity.LOW);
        assertClassified(new BusinessRuleException("rule"), HttpStatus.UNPROCESSABLE_ENTITY, ErrorSeverity.MEDIUM);
        assertClassified(new SecurityViolationException("schema", List.of("email: bad")),
                HttpStatus.BAD_REQUEST, ErrorSeverity.HIGH);
        assertClassified(new DatabaseException("db"), HttpStatus.INTERNAL_SERVER_ERROR, ErrorSeverity.HIGH);
    }

    @Test
    @DisplayName("should map framework errors onto the same rows")
    void shouldClassifyFrameworkErrors() {
        assertThat(ErrorClassification.classify(new AccessDeniedException("denied")))
                .isEqualTo(ErrorClassification.AUTHORIZATION);
        assertThat(ErrorClassification.classify(new ServerWebInputException("bad body")))
                .isEqualTo(ErrorClassification.VALIDATION);
    }

    @Test
    @DisplayName("should treat anything else as unclassified")
    void shouldFallBackToUnclassified() {
        ErrorClassification classification = ErrorClassification.classify(new IllegalStateException("boom"));

        assertThat(classification).isEqualTo(ErrorClassification.UNCLASSIFIED);
        assertThat(classification.status()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(classification.severity()).isEqualTo(ErrorSeverity.HIGH);
        assertThat(classification.exposesMessage()).isFalse();
    }

    @Test
    @DisplayName("should hide storage messages")
    void shouldHideDatabaseMessages() {
        assertThat(ErrorClassification.DATABASE.exposesMessage()).isFalse();
        assertThat(ErrorClassification.BUSINESS_RULE.exposesMessage()).isTrue();
    }

    private static void assertClassified(Throwable error, HttpStatus status, ErrorSeverity severity) {
        ErrorClassification classification = ErrorClassification.classify(error);
        assertThat(classification.status()).as(error.getClass().getSimpleName()).isEqualTo(status);
        assertThat(classification.severity()).as(error.getClass().getSimpleName()).isEqualTo(severity);
    }
}
