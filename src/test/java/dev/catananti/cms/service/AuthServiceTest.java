package dev.catananti.cms.service;

import dev.catananti.cms.dto.ChangePasswordRequest;
import dev.catananti.cms.dto.LoginRequest;
import dev.catananti.cms.dto.RegisterRequest;
import dev.catananti.cms.entity.User;
import dev.catananti.cms.exception.AuthenticationFailedException;
import dev.catananti.cms.exception.ErrorManager;
import dev.catananti.cms.exception.SecurityViolationException;
import dev.catananti.cms.exception.ValidationException;
import dev.catananti.cms.repository.UserRepository;
import dev.catananti.cms.security.CurrentUserService;
import dev.catananti.cms.security.JwtTokenProvider;
import dev.catananti.cms.validation.InputValidator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-04-01T12:00:00Z"), ZoneOffset.UTC);
    private static final String STRONG_PASSWORD = "Str0ng!Pass";

    @Mock
    private UserRepository userRepository;

    @Mock
    private PasswordEncoder passwordEncoder;

    @Mock
    private JwtTokenProvider jwtTokenProvider;

    @Mock
    private CurrentUserService currentUserService;

    private AuthService authService;

    @BeforeEach
    void setUp() {
        authService = new AuthService(
                userRepository,
                passwordEncoder,
                jwtTokenProvider,
                new InputValidator(Validation.buildDefaultValidatorFactory().getValidator()),
                new ErrorManager(CLOCK, new SimpleMeterRegistry()),
                currentUserService,
                CLOCK);
    }

    private User storedUser() {
        return User.builder()
                .id(1L)
                .email("john@example.com")
                .username("johndoe")
                .passwordHash("$2a$hash")
                .firstName("John")
                .lastName("Doe")
                .build();
    }

    @Nested
    @DisplayName("register")
    class Register {

        private RegisterRequest request() {
            return new RegisterRequest("John@Example.com", "johndoe", STRONG_PASSWORD, "John", "Doe");
        }

        @Test
        @DisplayName("should store a lower-cased email and a hashed password")
        void shouldRegister() {
            when(userRepository.existsByEmail("john@example.com")).thenReturn(Mono.just(false));
            when(userRepository.existsByUsername("johndoe")).thenReturn(Mono.just(false));
            when(passwordEncoder.encode(STRONG_PASSWORD)).thenReturn("$2a$hash");
            when(userRepository.save(any(User.class))).thenAnswer(invocation -> {
                User user = invocation.getArgument(0);
                user.setId(1L);
                return Mono.just(user);
            });

            StepVerifier.create(authService.register(request()))
                    .assertNext(response -> {
                        assertThat(response.getId()).isEqualTo(1L);
                        assertThat(response.getEmail()).isEqualTo("john@example.com");
                        assertThat(response.getUsername()).isEqualTo("johndoe");
                        assertThat(response.getFullName()).isEqualTo("John Doe");
                    })
                    .verifyComplete();

            ArgumentCaptor<User> saved = ArgumentCaptor.forClass(User.class);
            verify(userRepository).save(saved.capture());
            assertThat(saved.getValue().getPasswordHash()).isEqualTo("$2a$hash");
            assertThat(saved.getValue().getActive()).isTrue();
            assertThat(saved.getValue().hasStaffRights()).isFalse();
            assertThat(saved.getValue().getCreatedAt()).isEqualTo(LocalDateTime.of(2024, 4, 1, 12, 0));
        }

        @Test
        @DisplayName("should hide a duplicate email behind a generic message")
        void shouldRejectDuplicateEmail() {
            when(userRepository.existsByEmail("john@example.com")).thenReturn(Mono.just(true));

            StepVerifier.create(authService.register(request()))
                    .expectErrorSatisfies(ex -> {
                        assertThat(ex).isInstanceOf(ValidationException.class)
                                .hasMessage(AuthService.REGISTRATION_FAILED);
                        assertThat(((ValidationException) ex).getDetails())
                                .containsEntry("reason", "Email address already exists")
                                .containsEntry("operation", "user_registration");
                    })
                    .verify();

            verify(userRepository, never()).save(any());
        }

        @Test
        @DisplayName("should reject a taken username")
        void shouldRejectDuplicateUsername() {
            when(userRepository.existsByEmail("john@example.com")).thenReturn(Mono.just(false));
            when(userRepository.existsByUsername("johndoe")).thenReturn(Mono.just(true));

            StepVerifier.create(authService.register(request()))
                    .expectErrorSatisfies(ex -> assertThat(((ValidationException) ex).getDetails())
                            .containsEntry("reason", "Username already exists"))
                    .verify();
        }

        @Test
        @DisplayName("should report a constraint violation from the store")
        void shouldReportConstraintViolation() {
            when(userRepository.existsByEmail("john@example.com")).thenReturn(Mono.just(false));
            when(userRepository.existsByUsername("johndoe")).thenReturn(Mono.just(false));
            when(passwordEncoder.encode(STRONG_PASSWORD)).thenReturn("$2a$hash");
            when(userRepository.save(any(User.class)))
                    .thenReturn(Mono.error(new DataIntegrityViolationException("duplicate key (email)")));

            StepVerifier.create(authService.register(request()))
                    .expectErrorSatisfies(ex -> assertThat(ex)
                            .isInstanceOf(ValidationException.class)
                            .hasMessage(AuthService.REGISTRATION_FAILED))
                    .verify();
        }

        @Test
        @DisplayName("should list every schema violation")
        void shouldRejectInvalidSchema() {
            RegisterRequest invalid = new RegisterRequest("not-an-email", "jo", "weak", null, null);

            StepVerifier.create(authService.register(invalid))
                    .expectErrorSatisfies(ex -> {
                        assertThat(ex).isInstanceOf(SecurityViolationException.class);
                        assertThat(((SecurityViolationException) ex).getValidationErrors())
                                .anyMatch(error -> error.startsWith("email: "))
                                .anyMatch(error -> error.startsWith("username: "))
                                .anyMatch(error -> error.startsWith("password: "));
                    })
                    .verify();

            verifyNoInteractions(userRepository, passwordEncoder);
        }
    }

    @Nested
    @DisplayName("login")
    class Login {

        @Test
        @DisplayName("should issue a token and record the login time")
        void shouldLogin() {
            User user = storedUser();
            when(userRepository.findByEmail("john@example.com")).thenReturn(Mono.just(user));
            when(passwordEncoder.matches(STRONG_PASSWORD, "$2a$hash")).thenReturn(true);
            when(userRepository.save(user)).thenReturn(Mono.just(user));
            when(jwtTokenProvider.generateToken("john@example.com", "USER")).thenReturn("jwt-token");
            when(jwtTokenProvider.getExpirationSeconds()).thenReturn(86400L);

            StepVerifier.create(authService.login(new LoginRequest("John@example.com", STRONG_PASSWORD)))
                    .assertNext(response -> {
                        assertThat(response.getToken()).isEqualTo("jwt-token");
                        assertThat(response.getTokenType()).isEqualTo("Bearer");
                        assertThat(response.getExpiresIn()).isEqualTo(86400L);
                        assertThat(response.getUser().getDisplayName()).isEqualTo("John Doe");
                        assertThat(response.getUser().getLastLogin()).isEqualTo(LocalDateTime.of(2024, 4, 1, 12, 0));
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should not reveal whether the email exists")
        void shouldRejectUnknownEmail() {
            when(userRepository.findByEmail("ghost@example.com")).thenReturn(Mono.empty());

            StepVerifier.create(authService.login(new LoginRequest("ghost@example.com", STRONG_PASSWORD)))
                    .expectErrorSatisfies(ex -> {
                        assertThat(ex).isInstanceOf(AuthenticationFailedException.class)
                                .hasMessage(AuthService.AUTHENTICATION_FAILED);
                        assertThat(((AuthenticationFailedException) ex).getDetails())
                                .containsEntry("reason", AuthService.INVALID_CREDENTIALS)
                                .containsEntry("email", "ghost@example.com");
                    })
                    .verify();
        }

        @Test
        @DisplayName("should reject a deactivated account before checking the password")
        void shouldRejectInactiveAccount() {
            User user = storedUser();
            user.setActive(false);
            when(userRepository.findByEmail("john@example.com")).thenReturn(Mono.just(user));

            StepVerifier.create(authService.login(new LoginRequest("john@example.com", STRONG_PASSWORD)))
                    .expectErrorSatisfies(ex -> assertThat(((AuthenticationFailedException) ex).getDetails())
                            .containsEntry("reason", "Account is deactivated"))
                    .verify();

            verifyNoInteractions(passwordEncoder);
        }

        @Test
        @DisplayName("should reject a wrong password")
        void shouldRejectWrongPassword() {
            when(userRepository.findByEmail("john@example.com")).thenReturn(Mono.just(storedUser()));
            when(passwordEncoder.matches("Wrong!Pass1", "$2a$hash")).thenReturn(false);

            StepVerifier.create(authService.login(new LoginRequest("john@example.com", "Wrong!Pass1")))
                    .expectError(AuthenticationFailedException.class)
                    .verify();

            verify(userRepository, never()).save(any());
            verifyNoInteractions(jwtTokenProvider);
        }
    }

    @Nested
    @DisplayName("changePassword")
    class ChangePassword {

        @Test
        @DisplayName("should store the new hash")
        void shouldChangePassword() {
            User user = storedUser();
            when(currentUserService.requireUser()).thenReturn(Mono.just(user));
            when(passwordEncoder.matches(STRONG_PASSWORD, "$2a$hash")).thenReturn(true);
            when(passwordEncoder.encode("N3w!Password")).thenReturn("$2a$new");
            when(userRepository.save(user)).thenReturn(Mono.just(user));

            StepVerifier.create(authService.changePassword(new ChangePasswordRequest(STRONG_PASSWORD, "N3w!Password")))
                    .assertNext(response -> assertThat(response.message()).isEqualTo("Password changed successfully"))
                    .verifyComplete();

            assertThat(user.getPasswordHash()).isEqualTo("$2a$new");
        }

        @Test
        @DisplayName("should reject a wrong current password")
        void shouldRejectWrongCurrent() {
            when(currentUserService.requireUser()).thenReturn(Mono.just(storedUser()));
            when(passwordEncoder.matches("nope", "$2a$hash")).thenReturn(false);

            StepVerifier.create(authService.changePassword(new ChangePasswordRequest("nope", "N3w!Password")))
                    .expectErrorMatches(ex -> ex instanceof AuthenticationFailedException
                            && ex.getMessage().equals("Current password is incorrect"))
                    .verify();
        }

        @Test
        @DisplayName("should reject a weak new password")
        void shouldRejectWeakPassword() {
            when(currentUserService.requireUser()).thenReturn(Mono.just(storedUser()));
            when(passwordEncoder.matches(STRONG_PASSWORD, "$2a$hash")).thenReturn(true);

            StepVerifier.create(authService.changePassword(new ChangePasswordRequest(STRONG_PASSWORD, "weakpass")))
                    .expectErrorMatches(ex -> ex instanceof ValidationException
                            && ex.getMessage().equals("New password doesn't meet requirements"))
                    .verify();

            verify(userRepository, never()).save(any());
        }
    }
}
