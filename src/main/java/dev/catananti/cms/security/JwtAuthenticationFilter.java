package dev.catananti.cms.security;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.catananti.cms.entity.User;
import dev.catananti.cms.entity.UserRole;
import dev.catananti.cms.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Authenticates bearer tokens. A request whose token is missing, invalid or names an inactive user
 * continues unauthenticated; the security chain then decides whether the route needs a principal.
 */
@Component
@Slf4j
public class JwtAuthenticationFilter implements WebFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtTokenProvider tokenProvider;
    private final UserRepository userRepository;

    private final Cache<String, User> userCache = Caffeine.newBuilder()
            .maximumSize(1_000)
            .expireAfterWrite(Duration.ofMinutes(5))
            .build();

    public JwtAuthenticationFilter(JwtTokenProvider tokenProvider, UserRepository userRepository) {
        this.tokenProvider = tokenProvider;
        this.userRepository = userRepository;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String jwt = resolveToken(exchange);
        if (jwt == null) {
            return chain.filter(exchange);
        }

        var validation = tokenProvider.validateAndParseClaims(jwt);
        if (!validation.valid()) {
            log.debug("Ignoring bearer token on {}: {}", exchange.getRequest().getPath(), validation.error());
            return chain.filter(exchange);
        }

        String email = validation.claims().getSubject();
        String role = validation.claims().get("role", String.class);
        if (!UserRole.isValid(role)) {
            log.warn("Ignoring token with unknown role '{}'", role);
            return chain.filter(exchange);
        }

        return loadUser(email)
                .filter(user -> Boolean.TRUE.equals(user.getActive()))
                .map(user -> new UsernamePasswordAuthenticationToken(
                        user.getEmail(), null,
                        List.of(new SimpleGrantedAuthority("ROLE_" + user.roleName()))))
                .flatMap(auth -> chain.filter(exchange)
                        .contextWrite(ReactiveSecurityContextHolder.withAuthentication(auth))
                        .thenReturn(Boolean.TRUE))
                .switchIfEmpty(Mono.defer(() -> {
                    log.debug("Token user not found or inactive: {}", email);
                    return chain.filter(exchange).thenReturn(Boolean.FALSE);
                }))
                .then();
    }

    private Mono<User> loadUser(String email) {
        User cached = userCache.getIfPresent(email);
        if (cached != null) {
            return Mono.just(cached);
        }
        return userRepository.findByEmail(email)
                .doOnNext(user -> userCache.put(email, user));
    }

    private static String resolveToken(ServerWebExchange exchange) {
        String header = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (StringUtils.hasText(header) && header.startsWith(BEARER_PREFIX)) {
            String token = header.substring(BEARER_PREFIX.length()).trim();
            return token.isEmpty() ? null : token;
        }
        return null;
    }
}
