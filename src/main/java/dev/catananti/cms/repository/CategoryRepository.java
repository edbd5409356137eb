package dev.catananti.cms.repository;

import dev.catananti.cms.entity.Category;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface CategoryRepository extends ReactiveCrudRepository<Category, Long> {

    Mono<Category> findBySlug(String slug);

    @Query("SELECT * FROM categories WHERE slug = :slug AND is_active = TRUE")
    Mono<Category> findActiveBySlug(String slug);

    @Query("SELECT COUNT(*) > 0 FROM categories WHERE slug = :slug")
    Mono<Boolean> existsBySlug(String slug);

    @Query("SELECT COUNT(*) > 0 FROM categories WHERE slug = :slug AND id <> :excludeId")
    Mono<Boolean> existsBySlugAndIdNot(String slug, Long excludeId);

    @Query("SELECT * FROM categories ORDER BY name")
    Flux<Category> findAllOrderByName();

    @Query("SELECT * FROM categories WHERE is_active = TRUE ORDER BY name")
    Flux<Category> findActiveOrderByName();
}
