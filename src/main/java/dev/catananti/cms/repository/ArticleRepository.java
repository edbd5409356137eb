package dev.catananti.cms.repository;

import dev.catananti.cms.entity.Article;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface ArticleRepository extends ReactiveCrudRepository<Article, Long> {

    Mono<Article> findBySlug(String slug);

    @Query("SELECT * FROM articles WHERE slug = :slug AND is_published = TRUE")
    Mono<Article> findPublishedBySlug(String slug);

    @Query("SELECT COUNT(*) > 0 FROM articles WHERE slug = :slug")
    Mono<Boolean> existsBySlug(String slug);

    @Query("SELECT COUNT(*) > 0 FROM articles WHERE slug = :slug AND id <> :excludeId")
    Mono<Boolean> existsBySlugAndIdNot(String slug, Long excludeId);

    @Query("SELECT * FROM articles WHERE is_published = TRUE ORDER BY published_at DESC LIMIT :limit OFFSET :offset")
    Flux<Article> findPublished(int limit, int offset);

    @Query("SELECT COUNT(*) FROM articles WHERE is_published = TRUE")
    Mono<Long> countPublished();

    @Query("SELECT * FROM articles ORDER BY created_at DESC LIMIT :limit OFFSET :offset")
    Flux<Article> findAllOrderByCreatedAtDesc(int limit, int offset);

    @Query("SELECT COUNT(*) FROM articles")
    Mono<Long> countAll();

    @Query("SELECT * FROM articles WHERE author_id = :authorId ORDER BY created_at DESC LIMIT :limit OFFSET :offset")
    Flux<Article> findByAuthor(Long authorId, int limit, int offset);

    @Query("SELECT COUNT(*) FROM articles WHERE author_id = :authorId")
    Mono<Long> countByAuthor(Long authorId);

    @Query("SELECT * FROM articles WHERE category_id = :categoryId AND is_published = TRUE " +
           "ORDER BY published_at DESC LIMIT :limit OFFSET :offset")
    Flux<Article> findPublishedByCategory(Long categoryId, int limit, int offset);

    @Query("SELECT COUNT(*) FROM articles WHERE category_id = :categoryId AND is_published = TRUE")
    Mono<Long> countPublishedByCategory(Long categoryId);

    @Query("SELECT * FROM articles WHERE is_published = TRUE AND " +
           "(LOWER(title) LIKE LOWER(CONCAT('%', :query, '%')) ESCAPE '\\' OR " +
           "LOWER(content) LIKE LOWER(CONCAT('%', :query, '%')) ESCAPE '\\' OR " +
           "LOWER(excerpt) LIKE LOWER(CONCAT('%', :query, '%')) ESCAPE '\\') " +
           "ORDER BY published_at DESC LIMIT :limit OFFSET :offset")
    Flux<Article> searchPublished(String query, int limit, int offset);

    @Query("SELECT COUNT(*) FROM articles WHERE is_published = TRUE AND " +
           "(LOWER(title) LIKE LOWER(CONCAT('%', :query, '%')) ESCAPE '\\' OR " +
           "LOWER(content) LIKE LOWER(CONCAT('%', :query, '%')) ESCAPE '\\' OR " +
           "LOWER(excerpt) LIKE LOWER(CONCAT('%', :query, '%')) ESCAPE '\\')")
    Mono<Long> countSearchPublished(String query);
}
