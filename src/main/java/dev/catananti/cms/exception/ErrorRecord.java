package dev.catananti.cms.exception;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Outward view of a handled error. Diagnostic context only goes to the log.
 */
@JsonPropertyOrder({"error_id", "message", "severity", "timestamp", "type"})
public record ErrorRecord(
        @JsonProperty("error_id") String errorId,
        String message,
        ErrorSeverity severity,
        String timestamp,
        String type
) {
}
