package dev.catananti.cms.controller;

import dev.catananti.cms.dto.ApiResponse;
import dev.catananti.cms.dto.AuthResponse;
import dev.catananti.cms.dto.ChangePasswordRequest;
import dev.catananti.cms.dto.LoginRequest;
import dev.catananti.cms.dto.MessageResponse;
import dev.catananti.cms.dto.RegisterRequest;
import dev.catananti.cms.dto.UserResponse;
import dev.catananti.cms.service.AuthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Registration and login bodies are not bound with {@code @Valid}: {@link AuthService} schema-validates them
 * so a malformed payload is reported as a security violation.
 */
@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
@Tag(name = "Authentication", description = "Registration, login and password management")
@Slf4j
public class AuthController {

    private final AuthService authService;

    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Register a new user")
    public Mono<ApiResponse<UserResponse>> register(@RequestBody RegisterRequest request) {
        log.info("Registration attempt");
        return authService.register(request)
                .map(user -> ApiResponse.ok(user, "User registered successfully", HttpStatus.CREATED.value()));
    }

    @PostMapping("/login")
    @Operation(summary = "Authenticate and obtain a bearer token")
    public Mono<ApiResponse<AuthResponse>> login(@RequestBody LoginRequest request) {
        return authService.login(request)
                .map(auth -> ApiResponse.ok(auth, "Authentication successful", HttpStatus.OK.value()));
    }

    @PostMapping("/change-password")
    @Operation(summary = "Change the authenticated user's password")
    public Mono<ApiResponse<MessageResponse>> changePassword(@Valid @RequestBody ChangePasswordRequest request) {
        return authService.changePassword(request)
                .map(message -> ApiResponse.ok(message, HttpStatus.OK.value()));
    }

    @GetMapping("/me")
    @Operation(summary = "Current user profile")
    public Mono<ApiResponse<UserResponse>> me() {
        return authService.me().map(user -> ApiResponse.ok(user, HttpStatus.OK.value()));
    }
}
