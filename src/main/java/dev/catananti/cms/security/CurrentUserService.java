package dev.catananti.cms.security;

import dev.catananti.cms.entity.User;
import dev.catananti.cms.exception.AuthenticationFailedException;
import dev.catananti.cms.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Resolves the {@link User} behind the reactive security context.
 */
@Component
@RequiredArgsConstructor
public class CurrentUserService {

    private final UserRepository userRepository;

    /** Empty when the request is anonymous. */
    public Mono<User> currentUser() {
        return ReactiveSecurityContextHolder.getContext()
                .map(SecurityContext::getAuthentication)
                .filter(Authentication::isAuthenticated)
                .map(Authentication::getName)
                .flatMap(userRepository::findByEmail);
    }

    public Mono<User> requireUser() {
        return currentUser()
                .filter(user -> Boolean.TRUE.equals(user.getActive()))
                .switchIfEmpty(Mono.error(new AuthenticationFailedException("Authentication required")));
    }
}
