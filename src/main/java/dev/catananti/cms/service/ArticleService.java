package dev.catananti.cms.service;

import dev.catananti.cms.dto.ArticleRequest;
import dev.catananti.cms.dto.ArticleResponse;
import dev.catananti.cms.dto.ArticleUpdateRequest;
import dev.catananti.cms.dto.PageResponse;
import dev.catananti.cms.entity.Article;
import dev.catananti.cms.entity.Category;
import dev.catananti.cms.entity.User;
import dev.catananti.cms.exception.AuthorizationException;
import dev.catananti.cms.exception.BusinessRuleException;
import dev.catananti.cms.exception.DatabaseException;
import dev.catananti.cms.exception.ErrorManager;
import dev.catananti.cms.exception.ResourceNotFoundException;
import dev.catananti.cms.exception.ValidationException;
import dev.catananti.cms.repository.ArticleRepository;
import dev.catananti.cms.repository.CategoryRepository;
import dev.catananti.cms.repository.UserRepository;
import dev.catananti.cms.security.CurrentUserService;
import dev.catananti.cms.validation.InputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Article authoring and reading.
 * <p>
 * Authors edit their own articles; staff and superusers may edit any. Slug-bearing saves are single
 * statements so a unique-constraint rejection can be retried by {@link SlugService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ArticleService {

    static final int MAX_TITLE_LENGTH = 255;
    static final int MAX_EXCERPT_LENGTH = 500;
    static final int MAX_QUERY_LENGTH = 100;

    private final ArticleRepository articleRepository;
    private final CategoryRepository categoryRepository;
    private final UserRepository userRepository;
    private final SlugService slugService;
    private final PublishStateMachine publishStateMachine;
    private final HtmlSanitizerService htmlSanitizerService;
    private final InputValidator inputValidator;
    private final CurrentUserService currentUserService;
    private final ErrorManager errorManager;
    private final Clock clock;

    @Value("${cms.pagination.max-limit:100}")
    private int maxLimit = 100;

    public Mono<ArticleResponse> createArticle(ArticleRequest request) {
        return currentUserService.requireUser()
                .flatMap(author -> Mono.defer(() -> {
                            String title = inputValidator.sanitizeString(request.getTitle(), MAX_TITLE_LENGTH);
                            if (title == null || title.isEmpty()) {
                                return Mono.error(new ValidationException("Title is required"));
                            }
                            if (request.getContent() == null || request.getContent().isBlank()) {
                                return Mono.error(new ValidationException("Content is required"));
                            }
                            return validateCategory(request.getCategoryId())
                                    .then(Mono.defer(() -> insertArticle(author, title, request)));
                        })
                        .onErrorResume(ex -> ex instanceof ValidationException || ex instanceof DatabaseException,
                                ex -> Mono.error(OperationFailures.report(errorManager, ex,
                                        Map.of("operation", "article_creation", "author_id", author.getId()),
                                        OperationFailures.outwardMessage(ex)))))
                .doOnNext(article -> log.info("Article created: {}", article.getSlug()))
                .flatMap(this::toDetailResponse);
    }

    /**
     * Partial update. The slug follows the title only when the title changes; an {@code is_published}
     * flip goes through {@link PublishStateMachine}.
     */
    public Mono<ArticleResponse> updateArticle(Long id, ArticleUpdateRequest request) {
        return findEditable(id, "edit")
                .flatMap(article -> {
                    Mono<Void> categoryCheck = request.isCategoryIdPresent()
                            ? validateCategory(request.getCategoryId())
                            : Mono.empty();
                    return categoryCheck.then(Mono.defer(() -> applyUpdate(article, request)));
                })
                .doOnNext(article -> log.info("Article updated: {}", article.getSlug()))
                .flatMap(this::toDetailResponse);
    }

    public Mono<ArticleResponse> publishArticle(Long id) {
        return findEditable(id, "publish")
                .flatMap(article -> publishStateMachine.publish(article) ? touchAndSave(article) : Mono.just(article))
                .flatMap(this::toDetailResponse);
    }

    public Mono<ArticleResponse> unpublishArticle(Long id) {
        return findEditable(id, "unpublish")
                .flatMap(article -> publishStateMachine.unpublish(article) ? touchAndSave(article) : Mono.just(article))
                .flatMap(this::toDetailResponse);
    }

    @Transactional
    public Mono<Void> deleteArticle(Long id) {
        return findEditable(id, "delete")
                .flatMap(article -> articleRepository.delete(article)
                        .doOnSuccess(v -> log.info("Article deleted: {}", article.getSlug())));
    }

    /**
     * Lists articles. Drafts are only listed for staff.
     */
    public Mono<PageResponse<ArticleResponse>> listArticles(boolean publishedOnly, int skip, int limit) {
        return checkPaging(skip, limit).flatMap(pageLimit -> {
            if (publishedOnly) {
                return page(articleRepository.findPublished(pageLimit, skip),
                        articleRepository.countPublished(), skip, pageLimit);
            }
            return currentUserService.requireUser()
                    .filter(User::hasStaffRights)
                    .switchIfEmpty(Mono.error(new AuthorizationException("Staff privileges required to list drafts")))
                    .flatMap(staff -> page(articleRepository.findAllOrderByCreatedAtDesc(pageLimit, skip),
                            articleRepository.countAll(), skip, pageLimit));
        });
    }

    public Mono<ArticleResponse> getPublishedArticle(String slug) {
        return articleRepository.findPublishedBySlug(slug)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Article", "slug", slug)))
                .flatMap(this::toDetailResponse);
    }

    public Mono<PageResponse<ArticleResponse>> searchArticles(String query, int skip, int limit) {
        String term = inputValidator.sanitizeString(query, MAX_QUERY_LENGTH);
        if (term == null || term.isEmpty()) {
            return Mono.error(new ValidationException("Search query is required"));
        }
        String pattern = escapeLike(term);
        return checkPaging(skip, limit)
                .flatMap(pageLimit -> page(articleRepository.searchPublished(pattern, pageLimit, skip),
                        articleRepository.countSearchPublished(pattern), skip, pageLimit));
    }

    /** The search query matches literally; LIKE wildcards in it are escaped with a backslash. */
    static String escapeLike(String term) {
        return term.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }

    /** The caller's own articles, drafts included. */
    public Mono<PageResponse<ArticleResponse>> listMyArticles(int skip, int limit) {
        return checkPaging(skip, limit)
                .flatMap(pageLimit -> currentUserService.requireUser()
                        .flatMap(author -> page(articleRepository.findByAuthor(author.getId(), pageLimit, skip),
                                articleRepository.countByAuthor(author.getId()), skip, pageLimit)));
    }

    public Mono<PageResponse<ArticleResponse>> listCategoryArticles(String categorySlug, int skip, int limit) {
        return checkPaging(skip, limit)
                .flatMap(pageLimit -> categoryRepository.findActiveBySlug(categorySlug)
                        .switchIfEmpty(Mono.error(new ResourceNotFoundException("Category", "slug", categorySlug)))
                        .flatMap(category -> page(
                                articleRepository.findPublishedByCategory(category.getId(), pageLimit, skip),
                                articleRepository.countPublishedByCategory(category.getId()), skip, pageLimit)));
    }

    private Mono<Article> insertArticle(User author, String title, ArticleRequest request) {
        LocalDateTime now = LocalDateTime.now(clock);
        Article article = Article.builder()
                .title(title)
                .content(htmlSanitizerService.sanitize(request.getContent()))
                .excerpt(cleanExcerpt(request.getExcerpt()))
                .authorId(author.getId())
                .categoryId(request.getCategoryId())
                .createdAt(now)
                .updatedAt(now)
                .build();
        publishStateMachine.applyFlag(article, request.getIsPublished());
        return slugService.persistWithUniqueSlug(title, SlugScope.ARTICLE, null, slug -> {
            article.setSlug(slug);
            return articleRepository.save(article);
        });
    }

    private Mono<Article> applyUpdate(Article article, ArticleUpdateRequest request) {
        boolean retitled = false;
        if (request.getTitle() != null) {
            String title = inputValidator.sanitizeString(request.getTitle(), MAX_TITLE_LENGTH);
            if (title.isEmpty()) {
                return Mono.error(new ValidationException("Title cannot be empty"));
            }
            retitled = !title.equals(article.getTitle());
            article.setTitle(title);
        }
        if (request.getContent() != null) {
            if (request.getContent().isBlank()) {
                return Mono.error(new ValidationException("Content cannot be empty"));
            }
            article.setContent(htmlSanitizerService.sanitize(request.getContent()));
        }
        if (request.getExcerpt() != null) {
            article.setExcerpt(cleanExcerpt(request.getExcerpt()));
        }
        if (request.isCategoryIdPresent()) {
            article.setCategoryId(request.getCategoryId());
        }
        publishStateMachine.applyFlag(article, request.getIsPublished());
        article.setUpdatedAt(LocalDateTime.now(clock));

        if (!retitled) {
            return articleRepository.save(article);
        }
        return slugService.persistWithUniqueSlug(article.getTitle(), SlugScope.ARTICLE, article.getId(), slug -> {
            article.setSlug(slug);
            return articleRepository.save(article);
        });
    }

    private Mono<Article> findEditable(Long id, String action) {
        return currentUserService.requireUser()
                .flatMap(user -> articleRepository.findById(id)
                        .switchIfEmpty(Mono.error(new BusinessRuleException("Article not found", Map.of("article_id", id))))
                        .flatMap(article -> {
                            if (!canEdit(user, article)) {
                                log.warn("User {} denied {} on article {}", user.getId(), action, id);
                                return Mono.error(new AuthorizationException(
                                        "You don't have permission to " + action + " this article"));
                            }
                            return Mono.just(article);
                        }));
    }

    private static boolean canEdit(User user, Article article) {
        return user.hasStaffRights() || Objects.equals(user.getId(), article.getAuthorId());
    }

    private Mono<Void> validateCategory(Long categoryId) {
        if (categoryId == null) {
            return Mono.empty();
        }
        return categoryRepository.findById(categoryId)
                .filter(category -> Boolean.TRUE.equals(category.getActive()))
                .switchIfEmpty(Mono.error(new ValidationException("Invalid category selected",
                        Map.of("category_id", categoryId))))
                .then();
    }

    private Mono<Article> touchAndSave(Article article) {
        article.setUpdatedAt(LocalDateTime.now(clock));
        return articleRepository.save(article);
    }

    private String cleanExcerpt(String excerpt) {
        if (excerpt == null) {
            return null;
        }
        String text = inputValidator.sanitizeString(htmlSanitizerService.stripHtml(excerpt), MAX_EXCERPT_LENGTH);
        return text.isEmpty() ? null : text;
    }

    /**
     * @return the effective limit, capped at {@code cms.pagination.max-limit}
     */
    private Mono<Integer> checkPaging(int skip, int limit) {
        if (skip < 0) {
            return Mono.error(new ValidationException("skip must not be negative"));
        }
        if (limit < 1) {
            return Mono.error(new ValidationException("limit must be at least 1"));
        }
        return Mono.just(Math.min(limit, maxLimit));
    }

    private Mono<PageResponse<ArticleResponse>> page(Flux<Article> items, Mono<Long> total, int skip, int limit) {
        return Mono.zip(items.collectList(), total)
                .flatMap(tuple -> toResponses(tuple.getT1(), false)
                        .map(responses -> PageResponse.of(responses, skip, limit, tuple.getT2())));
    }

    private Mono<ArticleResponse> toDetailResponse(Article article) {
        return toResponses(List.of(article), true).map(list -> list.get(0));
    }

    /**
     * Resolves author display names and category names in two batched lookups.
     */
    private Mono<List<ArticleResponse>> toResponses(List<Article> articles, boolean includeContent) {
        if (articles.isEmpty()) {
            return Mono.just(List.of());
        }
        Set<Long> authorIds = articles.stream()
                .map(Article::getAuthorId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        Set<Long> categoryIds = articles.stream()
                .map(Article::getCategoryId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());

        Mono<Map<Long, String>> authors = authorIds.isEmpty()
                ? Mono.just(new HashMap<>())
                : userRepository.findAllById(authorIds).collectMap(User::getId, User::displayName);
        Mono<Map<Long, String>> categories = categoryIds.isEmpty()
                ? Mono.just(new HashMap<>())
                : categoryRepository.findAllById(categoryIds).collectMap(Category::getId, Category::getName);

        return Mono.zip(authors, categories)
                .map(names -> articles.stream()
                        .map(article -> {
                            article.setAuthorName(names.getT1().get(article.getAuthorId()));
                            article.setCategoryName(article.getCategoryId() == null
                                    ? null : names.getT2().get(article.getCategoryId()));
                            return toResponse(article, includeContent);
                        })
                        .toList());
    }

    private static ArticleResponse toResponse(Article article, boolean includeContent) {
        return ArticleResponse.builder()
                .id(article.getId())
                .title(article.getTitle())
                .slug(article.getSlug())
                .content(includeContent ? article.getContent() : null)
                .excerpt(article.getExcerpt())
                .isPublished(Boolean.TRUE.equals(article.getPublished()))
                .publishedAt(article.getPublishedAt())
                .authorId(article.getAuthorId())
                .author(article.getAuthorName())
                .categoryId(article.getCategoryId())
                .category(article.getCategoryName())
                .createdAt(article.getCreatedAt())
                .updatedAt(article.getUpdatedAt())
                .build();
    }
}
