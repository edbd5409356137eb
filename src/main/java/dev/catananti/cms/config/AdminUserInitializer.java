package dev.catananti.cms.config;

import dev.catananti.cms.entity.User;
import dev.catananti.cms.repository.UserRepository;
import dev.catananti.cms.validation.InputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Creates the bootstrap superuser from {@code cms.admin.*} when it does not exist yet.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AdminUserInitializer {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    @Value("${cms.admin.email:}")
    private String adminEmail;

    @Value("${cms.admin.password:}")
    private String adminPassword;

    @Value("${cms.admin.username:admin}")
    private String adminUsername;

    @EventListener(ApplicationReadyEvent.class)
    public void initializeAdminUser() {
        createAdminIfMissing().subscribe(
                created -> log.info("Bootstrap superuser created: {}", created.getUsername()),
                error -> log.error("Failed to initialize admin user: {}", error.getMessage(), error));
    }

    Mono<User> createAdminIfMissing() {
        if (adminEmail == null || adminEmail.isBlank() || adminPassword == null || adminPassword.isBlank()) {
            log.debug("Admin initialization skipped, cms.admin.email and cms.admin.password not set");
            return Mono.empty();
        }
        if (!InputValidator.isValidPassword(adminPassword)) {
            log.warn("cms.admin.password does not meet password requirements, skipping admin creation");
            return Mono.empty();
        }
        String email = adminEmail.trim().toLowerCase(Locale.ROOT);
        return userRepository.existsByEmail(email)
                .flatMap(exists -> {
                    if (exists) {
                        log.debug("Admin user already exists");
                        return Mono.empty();
                    }
                    return Mono.fromCallable(() -> passwordEncoder.encode(adminPassword))
                            .subscribeOn(Schedulers.boundedElastic())
                            .flatMap(hash -> {
                                LocalDateTime now = LocalDateTime.now(clock);
                                return userRepository.save(User.builder()
                                        .email(email)
                                        .username(adminUsername)
                                        .passwordHash(hash)
                                        .staff(true)
                                        .superuser(true)
                                        .createdAt(now)
                                        .updatedAt(now)
                                        .build());
                            });
                });
    }
}
