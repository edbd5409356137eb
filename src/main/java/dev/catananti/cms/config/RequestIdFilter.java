package dev.catananti.cms.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags every exchange with a request id.
 * An upstream {@code X-Request-ID} is reused when it is well formed, otherwise a 16-char id is generated.
 * The id is echoed in the response, kept as an exchange attribute for error reports
 * and written to the Reactor context.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class RequestIdFilter implements WebFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String REQUEST_ID_ATTRIBUTE = "cms.requestId";
    public static final String REQUEST_ID_CONTEXT_KEY = "requestId";

    private static final int MAX_ID_LENGTH = 64;
    private static final Pattern VALID_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9\\-_]+$");

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String externalId = exchange.getRequest().getHeaders().getFirst(REQUEST_ID_HEADER);
        String requestId = sanitizeId(externalId);
        if (requestId == null) {
            if (externalId != null && !externalId.isBlank()) {
                log.warn("Rejected malformed {} header", REQUEST_ID_HEADER);
            }
            requestId = UUID.randomUUID().toString().replace("-", "").substring(0, 16);
        }

        ServerHttpRequest mutatedRequest = exchange.getRequest().mutate()
                .header(REQUEST_ID_HEADER, requestId)
                .build();
        ServerWebExchange mutatedExchange = exchange.mutate().request(mutatedRequest).build();

        mutatedExchange.getResponse().getHeaders().set(REQUEST_ID_HEADER, requestId);
        mutatedExchange.getAttributes().put(REQUEST_ID_ATTRIBUTE, requestId);

        return chain.filter(mutatedExchange)
                .contextWrite(Context.of(REQUEST_ID_CONTEXT_KEY, requestId));
    }

    static String sanitizeId(String value) {
        if (value == null || value.isBlank()) return null;
        if (value.length() > MAX_ID_LENGTH) return null;
        if (!VALID_ID_PATTERN.matcher(value).matches()) return null;
        return value;
    }
}
