package dev.catananti.cms.service;

import dev.catananti.cms.dto.AuthResponse;
import dev.catananti.cms.dto.ChangePasswordRequest;
import dev.catananti.cms.dto.LoginRequest;
import dev.catananti.cms.dto.MessageResponse;
import dev.catananti.cms.dto.RegisterRequest;
import dev.catananti.cms.dto.UserResponse;
import dev.catananti.cms.entity.User;
import dev.catananti.cms.exception.AuthenticationFailedException;
import dev.catananti.cms.exception.DatabaseException;
import dev.catananti.cms.exception.ErrorManager;
import dev.catananti.cms.exception.ValidationException;
import dev.catananti.cms.repository.UserRepository;
import dev.catananti.cms.security.CurrentUserService;
import dev.catananti.cms.security.JwtTokenProvider;
import dev.catananti.cms.validation.InputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    static final String REGISTRATION_FAILED = "Registration failed. Please check your input.";
    static final String AUTHENTICATION_FAILED = "Authentication failed. Please check your credentials.";
    static final String INVALID_CREDENTIALS = "Invalid email or password";

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenProvider jwtTokenProvider;
    private final InputValidator inputValidator;
    private final ErrorManager errorManager;
    private final CurrentUserService currentUserService;
    private final Clock clock;

    /**
     * Creates an account. Duplicate email or username and storage failures are reported and
     * surface as a generic validation error; schema violations propagate unchanged.
     */
    public Mono<UserResponse> register(RegisterRequest request) {
        return Mono.fromCallable(() -> inputValidator.validateSchema(request))
                .flatMap(valid -> {
                    String email = valid.email().trim().toLowerCase(Locale.ROOT);
                    String username = valid.username().trim();
                    return ensureAvailable(email, username)
                            .then(encode(valid.password()))
                            .flatMap(hash -> {
                                LocalDateTime now = LocalDateTime.now(clock);
                                User user = User.builder()
                                        .email(email)
                                        .username(username)
                                        .passwordHash(hash)
                                        .firstName(inputValidator.sanitizeString(valid.firstName(), 50))
                                        .lastName(inputValidator.sanitizeString(valid.lastName(), 50))
                                        .createdAt(now)
                                        .updatedAt(now)
                                        .build();
                                return userRepository.save(user)
                                        .onErrorMap(DataIntegrityViolationException.class, ex -> new DatabaseException(
                                                "Failed to create user", Map.of("email", email), ex));
                            });
                })
                .doOnNext(user -> log.info("User registered: {}", user.getUsername()))
                .map(UserResponse::summary)
                .onErrorResume(ex -> ex instanceof ValidationException || ex instanceof DatabaseException,
                        ex -> Mono.error(OperationFailures.report(errorManager, ex,
                                Map.of("operation", "user_registration"), REGISTRATION_FAILED)));
    }

    public Mono<AuthResponse> login(LoginRequest request) {
        return Mono.fromCallable(() -> inputValidator.validateSchema(request))
                .flatMap(valid -> userRepository.findByEmail(valid.email().trim().toLowerCase(Locale.ROOT))
                        .switchIfEmpty(Mono.error(new AuthenticationFailedException(INVALID_CREDENTIALS)))
                        .flatMap(user -> {
                            if (!Boolean.TRUE.equals(user.getActive())) {
                                return Mono.error(new AuthenticationFailedException("Account is deactivated"));
                            }
                            return matches(valid.password(), user.getPasswordHash())
                                    .flatMap(passwordOk -> {
                                        if (!passwordOk) {
                                            return Mono.error(new AuthenticationFailedException(INVALID_CREDENTIALS));
                                        }
                                        user.setLastLogin(LocalDateTime.now(clock));
                                        return userRepository.save(user);
                                    });
                        }))
                .map(user -> {
                    log.info("User logged in: {}", user.getUsername());
                    return AuthResponse.builder()
                            .user(UserResponse.from(user))
                            .token(jwtTokenProvider.generateToken(user.getEmail(), user.roleName()))
                            .expiresIn(jwtTokenProvider.getExpirationSeconds())
                            .build();
                })
                .onErrorResume(AuthenticationFailedException.class, ex -> {
                    Map<String, Object> context = new HashMap<>();
                    context.put("operation", "user_authentication");
                    context.put("email", request.email());
                    return Mono.error(OperationFailures.report(errorManager, ex, context, AUTHENTICATION_FAILED));
                });
    }

    public Mono<MessageResponse> changePassword(ChangePasswordRequest request) {
        return currentUserService.requireUser()
                .flatMap(user -> matches(request.currentPassword(), user.getPasswordHash())
                        .flatMap(passwordOk -> {
                            if (!passwordOk) {
                                return Mono.error(new AuthenticationFailedException("Current password is incorrect"));
                            }
                            if (!InputValidator.isValidPassword(request.newPassword())) {
                                return Mono.error(new ValidationException("New password doesn't meet requirements"));
                            }
                            return encode(request.newPassword());
                        })
                        .flatMap(hash -> {
                            user.setPasswordHash(hash);
                            user.setUpdatedAt(LocalDateTime.now(clock));
                            return userRepository.save(user);
                        }))
                .doOnNext(user -> log.info("Password changed for user: {}", user.getUsername()))
                .thenReturn(new MessageResponse("Password changed successfully"));
    }

    public Mono<UserResponse> me() {
        return currentUserService.requireUser().map(UserResponse::from);
    }

    private Mono<Void> ensureAvailable(String email, String username) {
        return userRepository.existsByEmail(email)
                .flatMap(emailTaken -> {
                    if (emailTaken) {
                        return Mono.error(new ValidationException("Email address already exists"));
                    }
                    return userRepository.existsByUsername(username);
                })
                .flatMap(usernameTaken -> {
                    if (usernameTaken) {
                        return Mono.error(new ValidationException("Username already exists"));
                    }
                    return Mono.empty();
                })
                .then();
    }

    private Mono<String> encode(String rawPassword) {
        return Mono.fromCallable(() -> passwordEncoder.encode(rawPassword))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<Boolean> matches(String rawPassword, String hash) {
        return Mono.fromCallable(() -> passwordEncoder.matches(rawPassword, hash))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
