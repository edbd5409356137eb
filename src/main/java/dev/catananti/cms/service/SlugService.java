package dev.catananti.cms.service;

import dev.catananti.cms.exception.DatabaseException;
import dev.catananti.cms.repository.ArticleRepository;
import dev.catananti.cms.repository.CategoryRepository;
import dev.catananti.cms.util.SlugNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

/**
 * Assigns unique slugs for articles and categories.
 * <p>
 * The base slug is tried first, then {@code base-1}, {@code base-2} and so on until a free value is found.
 * The search is capped by {@code cms.slug.max-suffix-attempts}; past the cap a random 6-char suffix is used.
 * The check-then-insert sequence is not atomic, so {@link #persistWithUniqueSlug} also retries when the
 * store's unique constraint rejects a slug that a concurrent writer claimed first.
 */
@Service
@Slf4j
public class SlugService {

    private final ArticleRepository articleRepository;
    private final CategoryRepository categoryRepository;

    @Value("${cms.slug.max-suffix-attempts:1000}")
    private int maxSuffixAttempts = 1000;

    @Value("${cms.slug.max-conflict-retries:3}")
    private int maxConflictRetries = 3;

    public SlugService(ArticleRepository articleRepository, CategoryRepository categoryRepository) {
        this.articleRepository = articleRepository;
        this.categoryRepository = categoryRepository;
    }

    /**
     * @param excludeId row being updated, ignored by the existence check; {@code null} on create
     */
    public Mono<String> assignSlug(String candidate, SlugScope scope, Long excludeId) {
        String base = SlugNormalizer.normalize(candidate);
        return Flux.range(0, maxSuffixAttempts + 1)
                .map(n -> n == 0 ? base : SlugNormalizer.withSuffix(base, String.valueOf(n)))
                .concatMap(slug -> isTaken(slug, scope, excludeId)
                        .filter(taken -> !taken)
                        .map(free -> slug))
                .next()
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    String fallback = SlugNormalizer.withSuffix(base, UUID.randomUUID().toString().substring(0, 6));
                    log.warn("{} slug '{}' exhausted {} suffixes, using '{}'",
                            scope.label(), base, maxSuffixAttempts, fallback);
                    return fallback;
                }));
    }

    /**
     * Assigns a slug and hands it to {@code persister}. When the save trips the unique constraint because the
     * slug was claimed concurrently, a fresh slug is assigned and the save retried, up to
     * {@code cms.slug.max-conflict-retries} times. Constraint violations unrelated to the slug are not retried.
     */
    public <T> Mono<T> persistWithUniqueSlug(String candidate, SlugScope scope, Long excludeId,
                                             Function<String, Mono<T>> persister) {
        return persistAttempt(candidate, scope, excludeId, persister, 0);
    }

    public Mono<Boolean> isTaken(String slug, SlugScope scope, Long excludeId) {
        return switch (scope) {
            case ARTICLE -> excludeId == null
                    ? articleRepository.existsBySlug(slug)
                    : articleRepository.existsBySlugAndIdNot(slug, excludeId);
            case CATEGORY -> excludeId == null
                    ? categoryRepository.existsBySlug(slug)
                    : categoryRepository.existsBySlugAndIdNot(slug, excludeId);
        };
    }

    private <T> Mono<T> persistAttempt(String candidate, SlugScope scope, Long excludeId,
                                       Function<String, Mono<T>> persister, int attempt) {
        return assignSlug(candidate, scope, excludeId)
                .flatMap(slug -> persister.apply(slug)
                        .onErrorResume(DataIntegrityViolationException.class, ex -> isTaken(slug, scope, excludeId)
                                .flatMap(taken -> {
                                    if (!taken) {
                                        return Mono.error(new DatabaseException(
                                                "Failed to save " + scope.label(), Map.of("slug", slug), ex));
                                    }
                                    if (attempt >= maxConflictRetries) {
                                        return Mono.error(new DatabaseException(
                                                "Could not reserve a unique slug for " + scope.label(),
                                                Map.of("slug", slug, "attempts", attempt + 1), ex));
                                    }
                                    log.info("{} slug '{}' was claimed concurrently, retrying ({}/{})",
                                            scope.label(), slug, attempt + 1, maxConflictRetries);
                                    return persistAttempt(candidate, scope, excludeId, persister, attempt + 1);
                                })));
    }
}
