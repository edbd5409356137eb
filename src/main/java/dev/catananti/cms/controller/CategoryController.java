package dev.catananti.cms.controller;

import dev.catananti.cms.dto.ApiResponse;
import dev.catananti.cms.dto.ArticleResponse;
import dev.catananti.cms.dto.CategoryRequest;
import dev.catananti.cms.dto.CategoryResponse;
import dev.catananti.cms.dto.CategoryUpdateRequest;
import dev.catananti.cms.dto.PageResponse;
import dev.catananti.cms.service.ArticleService;
import dev.catananti.cms.service.CategoryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/categories")
@RequiredArgsConstructor
@Tag(name = "Categories", description = "Category management and browsing")
@Slf4j
public class CategoryController {

    private final CategoryService categoryService;
    private final ArticleService articleService;

    @GetMapping
    @Operation(summary = "List categories")
    public Mono<ApiResponse<List<CategoryResponse>>> listCategories(
            @RequestParam(name = "active_only", defaultValue = "true") boolean activeOnly) {
        return categoryService.listCategories(activeOnly)
                .map(categories -> ApiResponse.ok(categories, HttpStatus.OK.value()));
    }

    @GetMapping("/{slug}")
    @Operation(summary = "Get an active category by slug")
    public Mono<ApiResponse<CategoryResponse>> getCategory(@PathVariable String slug) {
        return categoryService.getCategoryBySlug(slug)
                .map(category -> ApiResponse.ok(category, HttpStatus.OK.value()));
    }

    @GetMapping("/{slug}/articles")
    @Operation(summary = "Published articles of a category")
    public Mono<ApiResponse<PageResponse<ArticleResponse>>> listCategoryArticles(
            @PathVariable String slug,
            @RequestParam(defaultValue = "0") int skip,
            @RequestParam(defaultValue = "20") int limit) {
        return articleService.listCategoryArticles(slug, skip, limit)
                .map(page -> ApiResponse.ok(page, HttpStatus.OK.value()));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @PreAuthorize("hasAnyRole('ADMIN', 'STAFF')")
    @Operation(summary = "Create a category")
    public Mono<ApiResponse<CategoryResponse>> createCategory(@Valid @RequestBody CategoryRequest request) {
        log.info("Creating category");
        return categoryService.createCategory(request)
                .map(category -> ApiResponse.ok(category, "Category created successfully", HttpStatus.CREATED.value()));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN', 'STAFF')")
    @Operation(summary = "Update a category")
    public Mono<ApiResponse<CategoryResponse>> updateCategory(@PathVariable Long id,
                                                              @Valid @RequestBody CategoryUpdateRequest request) {
        log.info("Updating category: id={}", id);
        return categoryService.updateCategory(id, request)
                .map(category -> ApiResponse.ok(category, "Category updated successfully", HttpStatus.OK.value()));
    }
}
