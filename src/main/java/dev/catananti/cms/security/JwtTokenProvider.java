package dev.catananti.cms.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

@Component
@Slf4j
public class JwtTokenProvider {

    /** HS512 needs at least 512 bits of key material. */
    private static final int MIN_SECRET_LENGTH = 64;
    private static final String AUDIENCE = "cms-api";

    private final Clock clock;

    @Value("${jwt.secret}")
    private String secret;

    @Value("${jwt.expiration:86400000}")
    private long expiration;

    @Value("${jwt.issuer:cms-backend}")
    private String issuer;

    private SecretKey key;
    private JwtParser jwtParser;

    public JwtTokenProvider(Clock clock) {
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        if (secret == null || secret.length() < MIN_SECRET_LENGTH) {
            throw new IllegalStateException(String.format(
                    "jwt.secret must be at least %d characters for HS512, got %d",
                    MIN_SECRET_LENGTH, secret == null ? 0 : secret.length()));
        }
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.jwtParser = Jwts.parser()
                .verifyWith(key)
                .requireIssuer(issuer)
                .requireAudience(AUDIENCE)
                .build();
        log.info("JWT token provider initialized, issuer={}", issuer);
    }

    public String generateToken(String email, String role) {
        Instant now = clock.instant();
        return Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(email)
                .claim("role", role)
                .issuer(issuer)
                .audience().add(AUDIENCE).and()
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plusMillis(expiration)))
                .signWith(key, Jwts.SIG.HS512)
                .compact();
    }

    /** Token lifetime in seconds, as reported to clients. */
    public long getExpirationSeconds() {
        return expiration / 1000;
    }

    public record TokenValidationResult(boolean valid, boolean expired, Claims claims, String error) {
        public static TokenValidationResult success(Claims claims) {
            return new TokenValidationResult(true, false, claims, null);
        }

        public static TokenValidationResult expired(String message) {
            return new TokenValidationResult(false, true, null, message);
        }

        public static TokenValidationResult invalid(String message) {
            return new TokenValidationResult(false, false, null, message);
        }
    }

    public TokenValidationResult validateAndParseClaims(String token) {
        try {
            return TokenValidationResult.success(jwtParser.parseSignedClaims(token).getPayload());
        } catch (ExpiredJwtException e) {
            log.debug("JWT token expired: {}", e.getMessage());
            return TokenValidationResult.expired("Token expired");
        } catch (JwtException e) {
            log.warn("JWT validation failed: {}", e.getMessage());
            return TokenValidationResult.invalid("Invalid token");
        } catch (IllegalArgumentException e) {
            log.warn("JWT token is null or empty");
            return TokenValidationResult.invalid("Empty or null token");
        }
    }

    public Optional<Claims> parseClaims(String token) {
        TokenValidationResult result = validateAndParseClaims(token);
        return result.valid() ? Optional.ofNullable(result.claims()) : Optional.empty();
    }

    public String getEmailFromToken(String token) {
        return parseClaims(token).map(Claims::getSubject).orElse(null);
    }

    public String getRoleFromToken(String token) {
        return parseClaims(token).map(c -> c.get("role", String.class)).orElse(null);
    }

    public boolean validateToken(String token) {
        return validateAndParseClaims(token).valid();
    }
}
