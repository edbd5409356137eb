package dev.catananti.cms.exception;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ErrorSeverity {
    LOW("A minor issue occurred. Please try again."),
    MEDIUM("An error occurred while processing your request."),
    HIGH("A serious error occurred. Please contact support."),
    CRITICAL("A critical system error occurred. Please contact support immediately.");

    private final String defaultMessage;

    ErrorSeverity(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
