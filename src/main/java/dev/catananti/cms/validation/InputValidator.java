package dev.catananti.cms.validation;

import dev.catananti.cms.exception.SecurityViolationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Field rules for user input plus schema validation of auth payloads.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InputValidator {

    public static final String USERNAME_REGEX = "^[a-zA-Z0-9_]+$";
    public static final String PASSWORD_REGEX = "^(?=.*[a-z])(?=.*[A-Z])(?=.*\\d)(?=.*[@$!%*?&])[A-Za-z\\d@$!%*?&].*$";

    public static final int MIN_PASSWORD_LENGTH = 8;
    public static final int MAX_PASSWORD_LENGTH = 128;
    public static final int DEFAULT_MAX_LENGTH = 255;

    private static final Pattern EMAIL = Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");
    private static final Pattern USERNAME = Pattern.compile(USERNAME_REGEX);
    private static final Pattern PASSWORD = Pattern.compile(PASSWORD_REGEX);
    // Tab, LF and CR are kept
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

    private final Validator validator;

    public static boolean isValidEmail(String email) {
        return email != null && EMAIL.matcher(email).matches();
    }

    public static boolean isValidUsername(String username) {
        return username != null && username.length() >= 3 && username.length() <= 30
                && USERNAME.matcher(username).matches();
    }

    public static boolean isValidPassword(String password) {
        return password != null
                && password.length() >= MIN_PASSWORD_LENGTH
                && password.length() <= MAX_PASSWORD_LENGTH
                && PASSWORD.matcher(password).matches();
    }

    /**
     * Removes control characters, trims and truncates. {@code null} stays {@code null}.
     */
    public String sanitizeString(String value, int maxLength) {
        if (value == null) {
            return null;
        }
        String cleaned = CONTROL_CHARS.matcher(value).replaceAll("").trim();
        return cleaned.length() > maxLength ? cleaned.substring(0, maxLength) : cleaned;
    }

    public String sanitizeString(String value) {
        return sanitizeString(value, DEFAULT_MAX_LENGTH);
    }

    /**
     * Runs Bean Validation on the payload.
     *
     * @throws SecurityViolationException listing every {@code field: message} violation, sorted
     */
    public <T> T validateSchema(T payload) {
        if (payload == null) {
            throw new SecurityViolationException("Invalid input data", List.of("Request body is required"));
        }
        Set<ConstraintViolation<T>> violations = validator.validate(payload);
        if (!violations.isEmpty()) {
            List<String> errors = violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted()
                    .toList();
            log.debug("Rejected {} payload: {}", payload.getClass().getSimpleName(), errors);
            throw new SecurityViolationException("Invalid input data", errors);
        }
        return payload;
    }
}
