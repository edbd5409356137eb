package dev.catananti.cms.exception;

import dev.catananti.cms.config.RequestIdFilter;
import dev.catananti.cms.dto.ApiResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Single HTTP boundary for errors: classify, hand to {@link ErrorManager}, answer with the envelope.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

    static final String INVALID_REQUEST_DATA = "Invalid request data";

    private final ErrorManager errorManager;

    @ExceptionHandler(CmsException.class)
    public Mono<ResponseEntity<ApiResponse<Void>>> handleCmsException(CmsException ex, ServerWebExchange exchange) {
        ErrorClassification classification = ErrorClassification.classify(ex);
        Map<String, Object> context = baseContext(exchange);
        context.putAll(ex.getDetails());
        String userMessage = classification.exposesMessage() ? ex.getMessage() : null;
        ApiResponse<Void> body = respond(ex, classification, context, userMessage);
        if (ex instanceof SecurityViolationException violation) {
            body.setValidationErrors(violation.getValidationErrors());
        }
        return Mono.just(ResponseEntity.status(classification.status()).body(body));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ApiResponse<Void>>> handleBindException(WebExchangeBindException ex,
                                                                        ServerWebExchange exchange) {
        List<String> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(this::describe)
                .sorted()
                .toList();
        Map<String, Object> context = baseContext(exchange);
        context.put("validation_errors", errors);
        ErrorClassification classification = ErrorClassification.VALIDATION;
        ApiResponse<Void> body = respond(ex, classification, context, INVALID_REQUEST_DATA);
        body.setValidationErrors(errors);
        return Mono.just(ResponseEntity.status(classification.status()).body(body));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ApiResponse<Void>>> handleInputException(ServerWebInputException ex,
                                                                         ServerWebExchange exchange) {
        ErrorClassification classification = ErrorClassification.VALIDATION;
        ApiResponse<Void> body = respond(ex, classification, baseContext(exchange), INVALID_REQUEST_DATA);
        return Mono.just(ResponseEntity.status(classification.status()).body(body));
    }

    @ExceptionHandler(AccessDeniedException.class)
    public Mono<ResponseEntity<ApiResponse<Void>>> handleAccessDenied(AccessDeniedException ex,
                                                                       ServerWebExchange exchange) {
        ErrorClassification classification = ErrorClassification.AUTHORIZATION;
        ApiResponse<Void> body = respond(ex, classification, baseContext(exchange),
                "You don't have permission to perform this action");
        return Mono.just(ResponseEntity.status(classification.status()).body(body));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiResponse<Void>>> handleResponseStatus(ResponseStatusException ex,
                                                                         ServerWebExchange exchange) {
        HttpStatusCode status = ex.getStatusCode();
        if (status.is5xxServerError()) {
            return handleUnexpected(ex, exchange);
        }
        HttpStatus resolved = HttpStatus.resolve(status.value());
        String message = ex.getReason() != null ? ex.getReason()
                : resolved != null ? resolved.getReasonPhrase() : "Request failed";
        ErrorRecord record = errorManager.handle(ex, ErrorSeverity.MEDIUM, baseContext(exchange), message);
        return Mono.just(ResponseEntity.status(status).body(ApiResponse.failure(record, status.value())));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiResponse<Void>>> handleUnexpected(Exception ex, ServerWebExchange exchange) {
        ErrorClassification classification = ErrorClassification.classify(ex);
        ApiResponse<Void> body = respond(ex, classification, baseContext(exchange),
                classification.exposesMessage() ? ex.getMessage() : null);
        return Mono.just(ResponseEntity.status(classification.status()).body(body));
    }

    private ApiResponse<Void> respond(Throwable ex, ErrorClassification classification,
                                      Map<String, Object> context, String userMessage) {
        ErrorRecord record = errorManager.handle(ex, classification.severity(), context, userMessage);
        return ApiResponse.failure(record, classification.status().value());
    }

    private Map<String, Object> baseContext(ServerWebExchange exchange) {
        Map<String, Object> context = new HashMap<>();
        context.put("path", exchange.getRequest().getPath().value());
        context.put("method", String.valueOf(exchange.getRequest().getMethod()));
        Object requestId = exchange.getAttribute(RequestIdFilter.REQUEST_ID_ATTRIBUTE);
        if (requestId != null) {
            context.put("request_id", requestId);
        }
        return context;
    }

    private String describe(FieldError error) {
        String message = error.getDefaultMessage() != null ? error.getDefaultMessage() : "invalid value";
        return error.getField() + ": " + message;
    }
}
