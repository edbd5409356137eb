package dev.catananti.cms.exception;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.UUID;

/**
 * Turns a raised error into an {@link ErrorRecord}: fresh error id, UTC timestamp, outward message,
 * one log line whose level follows the severity, and a {@code cms.errors} counter increment.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ErrorManager {

    static final String ERROR_COUNTER = "cms.errors";

    private static final DateTimeFormatter ID_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'");

    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public ErrorRecord handle(Throwable error, ErrorSeverity severity) {
        return handle(error, severity, Map.of(), null);
    }

    /**
     * @param context     diagnostic key/values, logged only
     * @param userMessage outward message; {@code null} selects the severity default
     */
    public ErrorRecord handle(Throwable error, ErrorSeverity severity, Map<String, ?> context, String userMessage) {
        ZonedDateTime now = ZonedDateTime.now(clock).withZoneSameInstant(ZoneOffset.UTC);
        String errorId = "error_" + ID_DATE.format(now) + "_" + UUID.randomUUID().toString().substring(0, 8);
        String type = error.getClass().getSimpleName();
        String message = userMessage != null && !userMessage.isBlank() ? userMessage : severity.defaultMessage();
        Map<String, ?> safeContext = context == null ? Map.of() : context;

        try (MDC.MDCCloseable ignoredId = MDC.putCloseable("error_id", errorId);
             MDC.MDCCloseable ignoredSeverity = MDC.putCloseable("severity", severity.value())) {
            switch (severity) {
                case CRITICAL, HIGH -> log.error("Error {} [{}] {}: {} context={}",
                        errorId, severity, type, error.getMessage(), safeContext, error);
                case MEDIUM -> log.warn("Error {} [{}] {}: {} context={}",
                        errorId, severity, type, error.getMessage(), safeContext);
                case LOW -> log.info("Error {} [{}] {}: {} context={}",
                        errorId, severity, type, error.getMessage(), safeContext);
            }
        }

        Counter.builder(ERROR_COUNTER)
                .description("Errors handled, by severity and type")
                .tag("severity", severity.value())
                .tag("type", type)
                .register(meterRegistry)
                .increment();

        return new ErrorRecord(errorId, message, severity, TIMESTAMP.format(now), type);
    }
}
