package dev.catananti.cms.service;

import dev.catananti.cms.dto.CategoryRequest;
import dev.catananti.cms.dto.CategoryResponse;
import dev.catananti.cms.dto.CategoryUpdateRequest;
import dev.catananti.cms.entity.Category;
import dev.catananti.cms.entity.User;
import dev.catananti.cms.exception.AuthorizationException;
import dev.catananti.cms.exception.BusinessRuleException;
import dev.catananti.cms.exception.DatabaseException;
import dev.catananti.cms.exception.ErrorManager;
import dev.catananti.cms.exception.ResourceNotFoundException;
import dev.catananti.cms.exception.ValidationException;
import dev.catananti.cms.repository.CategoryRepository;
import dev.catananti.cms.security.CurrentUserService;
import dev.catananti.cms.validation.InputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Category management. Names need not be unique; the slug is the public identity of a category.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CategoryService {

    static final int MAX_NAME_LENGTH = 100;
    static final int MAX_DESCRIPTION_LENGTH = 500;

    private final CategoryRepository categoryRepository;
    private final SlugService slugService;
    private final CurrentUserService currentUserService;
    private final InputValidator inputValidator;
    private final ErrorManager errorManager;
    private final Clock clock;

    public Mono<CategoryResponse> createCategory(CategoryRequest request) {
        return requireStaff()
                .then(Mono.defer(() -> {
                    String name = inputValidator.sanitizeString(request.getName(), MAX_NAME_LENGTH);
                    if (name == null || name.isEmpty()) {
                        return Mono.error(new ValidationException("Category name is required"));
                    }
                    LocalDateTime now = LocalDateTime.now(clock);
                    Category category = Category.builder()
                            .name(name)
                            .description(emptyToNull(inputValidator.sanitizeString(
                                    request.getDescription(), MAX_DESCRIPTION_LENGTH)))
                            .active(request.getIsActive() == null || request.getIsActive())
                            .createdAt(now)
                            .updatedAt(now)
                            .build();
                    return slugService.persistWithUniqueSlug(name, SlugScope.CATEGORY, null, slug -> {
                        category.setSlug(slug);
                        return categoryRepository.save(category);
                    });
                }))
                .doOnNext(category -> log.info("Category created: {}", category.getSlug()))
                .map(CategoryResponse::from)
                .onErrorResume(ex -> ex instanceof ValidationException || ex instanceof DatabaseException,
                        ex -> Mono.error(OperationFailures.report(errorManager, ex,
                                Map.of("operation", "category_creation"), OperationFailures.outwardMessage(ex))));
    }

    /**
     * Partial update. The slug is re-derived only when the name actually changes.
     */
    public Mono<CategoryResponse> updateCategory(Long id, CategoryUpdateRequest request) {
        return requireStaff()
                .then(Mono.defer(() -> categoryRepository.findById(id)))
                .switchIfEmpty(Mono.error(new BusinessRuleException("Category not found", Map.of("category_id", id))))
                .flatMap(category -> {
                    String name = request.getName() == null
                            ? null
                            : inputValidator.sanitizeString(request.getName(), MAX_NAME_LENGTH);
                    if (name != null && name.isEmpty()) {
                        return Mono.error(new ValidationException("Category name cannot be empty"));
                    }
                    boolean renamed = name != null && !name.equals(category.getName());

                    if (request.getDescription() != null) {
                        category.setDescription(emptyToNull(inputValidator.sanitizeString(
                                request.getDescription(), MAX_DESCRIPTION_LENGTH)));
                    }
                    if (request.getIsActive() != null) {
                        category.setActive(request.getIsActive());
                    }
                    category.setUpdatedAt(LocalDateTime.now(clock));

                    if (!renamed) {
                        return categoryRepository.save(category);
                    }
                    category.setName(name);
                    return slugService.persistWithUniqueSlug(name, SlugScope.CATEGORY, id, slug -> {
                        category.setSlug(slug);
                        return categoryRepository.save(category);
                    });
                })
                .doOnNext(category -> log.info("Category updated: {}", category.getSlug()))
                .map(CategoryResponse::from);
    }

    public Mono<List<CategoryResponse>> listCategories(boolean activeOnly) {
        Flux<Category> categories = activeOnly
                ? categoryRepository.findActiveOrderByName()
                : categoryRepository.findAllOrderByName();
        return categories.map(CategoryResponse::from).collectList();
    }

    /** Inactive categories are reported as missing. */
    public Mono<CategoryResponse> getCategoryBySlug(String slug) {
        return categoryRepository.findActiveBySlug(slug)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Category", "slug", slug)))
                .map(CategoryResponse::from);
    }

    private Mono<User> requireStaff() {
        return currentUserService.requireUser()
                .filter(User::hasStaffRights)
                .switchIfEmpty(Mono.error(new AuthorizationException("Staff privileges required")));
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
