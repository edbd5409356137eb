package dev.catananti.cms.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.catananti.cms.config.RequestIdFilter;
import dev.catananti.cms.dto.ApiResponse;
import dev.catananti.cms.exception.AuthenticationFailedException;
import dev.catananti.cms.exception.AuthorizationException;
import dev.catananti.cms.exception.CmsException;
import dev.catananti.cms.exception.ErrorClassification;
import dev.catananti.cms.exception.ErrorManager;
import dev.catananti.cms.exception.ErrorRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.MediaType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.server.ServerAuthenticationEntryPoint;
import org.springframework.security.web.server.authorization.ServerAccessDeniedHandler;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Writes 401 and 403 responses raised inside the security chain, before any controller runs,
 * in the same envelope the exception handler produces.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SecurityErrorResponder implements ServerAuthenticationEntryPoint, ServerAccessDeniedHandler {

    private final ErrorManager errorManager;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> commence(ServerWebExchange exchange, AuthenticationException ex) {
        return write(exchange, new AuthenticationFailedException("Authentication required"));
    }

    @Override
    public Mono<Void> handle(ServerWebExchange exchange, AccessDeniedException denied) {
        return write(exchange, new AuthorizationException("You don't have permission to perform this action"));
    }

    private Mono<Void> write(ServerWebExchange exchange, CmsException error) {
        ErrorClassification classification = ErrorClassification.classify(error);
        Map<String, Object> context = new HashMap<>();
        context.put("path", exchange.getRequest().getPath().value());
        context.put("method", String.valueOf(exchange.getRequest().getMethod()));
        Object requestId = exchange.getAttribute(RequestIdFilter.REQUEST_ID_ATTRIBUTE);
        if (requestId != null) {
            context.put("request_id", requestId);
        }

        ErrorRecord record = errorManager.handle(error, classification.severity(), context, error.getMessage());
        ApiResponse<Void> body = ApiResponse.failure(record, classification.status().value());

        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize security error {}", record.errorId(), e);
            return Mono.error(e);
        }

        exchange.getResponse().setStatusCode(classification.status());
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
        DataBuffer buffer = exchange.getResponse().bufferFactory().wrap(bytes);
        return exchange.getResponse().writeWith(Mono.just(buffer));
    }
}
