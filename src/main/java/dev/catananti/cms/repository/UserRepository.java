package dev.catananti.cms.repository;

import dev.catananti.cms.entity.User;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface UserRepository extends ReactiveCrudRepository<User, Long> {

    @Query("SELECT * FROM users WHERE email = LOWER(:email)")
    Mono<User> findByEmail(String email);

    @Query("SELECT COUNT(*) > 0 FROM users WHERE email = LOWER(:email)")
    Mono<Boolean> existsByEmail(String email);

    @Query("SELECT COUNT(*) > 0 FROM users WHERE LOWER(username) = LOWER(:username)")
    Mono<Boolean> existsByUsername(String username);

    @Query("SELECT COUNT(*) > 0 FROM users WHERE is_superuser = TRUE")
    Mono<Boolean> existsSuperuser();
}
